package com.screening.controller;

import com.screening.engine.IdentityRecord;
import com.screening.model.PersonType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Identity as submitted by callers.
 *
 * Individuals usually send name parts, legal entities a {@code fullName}.
 * Whether the result is screenable (a name token or a tax id) is checked when
 * it is turned into an {@link IdentityRecord}.
 */
@Data
public class IdentityRequest {

    @NotNull(message = "Person type is required")
    private PersonType personType;

    @Size(max = 200)
    private String givenName;

    @Size(max = 200)
    private String paternalSurname;

    @Size(max = 200)
    private String maternalSurname;

    @Size(max = 400)
    private String fullName;

    @Size(max = 13, message = "Tax id has at most 13 characters")
    private String taxId;

    public IdentityRecord toIdentityRecord() {
        return new IdentityRecord(personType, givenName, paternalSurname, maternalSurname, fullName, taxId);
    }
}
