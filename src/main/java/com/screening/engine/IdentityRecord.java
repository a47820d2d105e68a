package com.screening.engine;

import com.screening.exception.InvalidIdentityException;
import com.screening.model.PersonType;

import java.util.Locale;

/**
 * Identity submitted to a single screening run.
 *
 * Immutable. The full name is derived from the name parts when it is not
 * supplied. The tax identifier (RFC) is trimmed and upper-cased.
 */
public record IdentityRecord(
    PersonType personType,
    String givenName,
    String paternalSurname,
    String maternalSurname,
    String fullName,
    String taxId
) {
    public IdentityRecord {
        if (personType == null) {
            throw new InvalidIdentityException("Person type is required");
        }
        if (fullName == null || fullName.isBlank()) {
            fullName = joinParts(givenName, paternalSurname, maternalSurname);
        } else {
            fullName = fullName.trim();
        }
        taxId = (taxId == null || taxId.isBlank()) ? null : taxId.trim().toUpperCase(Locale.ROOT);

        if (NameNormalizer.normalizeText(fullName).isEmpty() && taxId == null) {
            throw new InvalidIdentityException("Identity has no usable name or tax identifier");
        }
    }

    public static IdentityRecord of(PersonType personType, String fullName, String taxId) {
        return new IdentityRecord(personType, null, null, null, fullName, taxId);
    }

    public boolean hasTaxId() {
        return taxId != null;
    }

    public NormalizedName normalizedName() {
        return NameNormalizer.normalize(fullName);
    }

    private static String joinParts(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part.trim());
            }
        }
        return sb.toString();
    }
}
