package com.screening.event;

import com.screening.model.DispositionState;
import com.screening.model.RiskTier;

import java.time.Instant;
import java.util.List;

/**
 * Published when a subject's disposition goes through an alert-worthy transition.
 *
 * Carries both the previous and the new state; consumers (case management,
 * compliance reporting) never need to look up what the subject was before.
 */
public record ScreeningAlertRaised(
    String alertId,
    String subjectId,
    String reason,
    DispositionState previousState,
    DispositionState newState,
    RiskTier previousTier,
    RiskTier newTier,
    Integer previousScore,
    int newScore,
    List<String> newHardBlockSources,
    List<String> alerts,
    String snapshotVersion,
    Instant timestamp
) {
    public ScreeningAlertRaised {
        if (alertId == null || alertId.isBlank()) {
            throw new IllegalArgumentException("Alert ID cannot be null or empty");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or empty");
        }
        if (newState == null) {
            throw new IllegalArgumentException("New state cannot be null");
        }
        newHardBlockSources = newHardBlockSources == null ? List.of() : List.copyOf(newHardBlockSources);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
