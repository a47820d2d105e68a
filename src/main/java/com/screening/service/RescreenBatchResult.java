package com.screening.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Summary of one rescreen batch.
 *
 * {@code processedCount} counts subjects screened and persisted; subjects that
 * failed or missed the deadline are counted in {@code failedCount} only.
 */
public record RescreenBatchResult(
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("trigger") String trigger,
    @JsonProperty("total_subjects") int totalSubjects,
    @JsonProperty("processed_count") int processedCount,
    @JsonProperty("updated_count") int updatedCount,
    @JsonProperty("alerts_generated_count") int alertsGeneratedCount,
    @JsonProperty("failed_count") int failedCount,
    @JsonProperty("snapshot_version") String snapshotVersion,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt
) {
}
