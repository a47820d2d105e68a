package com.screening.engine.snapshot;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One row of a snapshot file as written by the upstream list refresher.
 * The Spanish aliases are the field names of the upstream export.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SnapshotFileEntry(
    String uid,
    @JsonAlias({"nombre_completo", "nombre"}) String fullName,
    @JsonAlias({"tipo", "tipo_lista"}) String category,
    @JsonAlias("fecha_inclusion") String inclusionDate,
    @JsonAlias("cargo") String position,
    @JsonAlias("institucion") String institution,
    @JsonAlias("rfc") String taxId
) {
    boolean isUsable() {
        return (fullName != null && !fullName.isBlank()) || (taxId != null && !taxId.isBlank());
    }
}
