package com.screening.engine.snapshot;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
record SnapshotMetadata(@JsonAlias("fecha_actualizacion") String updatedAt) {
}
