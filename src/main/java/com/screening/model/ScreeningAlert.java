package com.screening.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of an alert-worthy disposition transition.
 *
 * Append-only. Carries both sides of the transition so the prior state can
 * be reconstructed without relying on the (overwritten) disposition row.
 */
@Entity
@Table(name = "screening_alerts",
       indexes = @Index(name = "idx_alert_subject", columnList = "subjectId"))
@Data
@NoArgsConstructor
public class ScreeningAlert {

    @Id
    private String alertId;

    @Column(nullable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertReason reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DispositionState previousState;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DispositionState newState;

    @Enumerated(EnumType.STRING)
    private RiskTier previousTier;

    @Enumerated(EnumType.STRING)
    private RiskTier newTier;

    private Integer previousScore;

    private Integer newScore;

    /** Comma separated hard-block sources hit now but not before. */
    private String newHardBlockSources;

    @Column(length = 2000)
    private String details;

    @Column(length = 1000)
    private String snapshotVersion;

    @Column(nullable = false)
    private Instant raisedAt;

    public enum AlertReason {
        NEWLY_REJECTED,         // Decision moved from non-rejected to REJECTED
        NEW_HARD_BLOCK_HIT,     // A hard-block list hit that was absent before
        REJECTED_WITH_NEW_HARD_BLOCK_HIT
    }

    @PrePersist
    protected void onCreate() {
        if (raisedAt == null) {
            raisedAt = Instant.now();
        }
    }
}
