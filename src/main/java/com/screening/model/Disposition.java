package com.screening.model;

import com.screening.engine.ListSource;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current screening state of a subject.
 *
 * One row per subject, created PENDING on registration and superseded in
 * place by every screening that changes something. Never deleted; the
 * history of alert-worthy transitions lives in {@link ScreeningAlert}.
 *
 * HIT FLAGS:
 * ==========
 * One boolean per reference list, set when the latest screening found the
 * subject on it. A hard-block flag turning true is what raises an alert.
 *
 * CONCURRENCY:
 * ============
 * Optimistic locking through {@code version}. A batch and an on-demand
 * rescreen writing the same subject at once cannot both win; the loser fails
 * with an optimistic lock error and is counted or reported as a failure.
 */
@Entity
@Table(name = "dispositions",
       indexes = {
           @Index(name = "idx_disposition_state", columnList = "state"),
           @Index(name = "idx_disposition_alert", columnList = "alertActive")
       })
@Data
@NoArgsConstructor
public class Disposition {

    @Id
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DispositionState state = DispositionState.PENDING;

    @Enumerated(EnumType.STRING)
    private RiskTier tier;

    private Integer score;

    // Per-source hit flags
    @Column(nullable = false)
    private boolean ofacHit;

    @Column(nullable = false)
    private boolean unHit;

    @Column(nullable = false)
    private boolean domesticBlockedHit;

    @Column(nullable = false)
    private boolean pepHit;

    @Column(nullable = false)
    private boolean deregisteredHit;

    /** Set when an alert-worthy transition happened; cleared by a later clean screening. */
    @Column(nullable = false)
    private boolean alertActive;

    private Instant lastScreenedAt;

    /** Composite snapshot version used by the last screening that wrote this row. */
    @Column(length = 1000)
    private String snapshotVersion;

    @Version
    private Long version;

    public static Disposition pending(String subjectId) {
        Disposition disposition = new Disposition();
        disposition.setSubjectId(subjectId);
        disposition.setState(DispositionState.PENDING);
        return disposition;
    }

    public boolean isHit(ListSource source) {
        return switch (source) {
            case OFAC -> ofacHit;
            case UN_SECURITY_COUNCIL -> unHit;
            case DOMESTIC_BLOCKED -> domesticBlockedHit;
            case PEP -> pepHit;
            case DEREGISTERED_ENTITY -> deregisteredHit;
        };
    }

    public void setHit(ListSource source, boolean hit) {
        switch (source) {
            case OFAC -> ofacHit = hit;
            case UN_SECURITY_COUNCIL -> unHit = hit;
            case DOMESTIC_BLOCKED -> domesticBlockedHit = hit;
            case PEP -> pepHit = hit;
            case DEREGISTERED_ENTITY -> deregisteredHit = hit;
        }
    }
}
