package com.screening.service;

import com.screening.engine.ListSource;
import com.screening.engine.RiskAssessment;
import com.screening.model.Disposition;
import com.screening.model.DispositionState;
import com.screening.model.RiskTier;
import com.screening.model.ScreeningAlert.AlertReason;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Difference between a stored disposition and a fresh assessment.
 *
 * Pure value; computing it touches neither the database nor the cache.
 * A change is material when the state, tier, score or any per-source hit
 * flag differs. It is alert-worthy when the subject moves into REJECTED
 * from any other state, or when a hard-block source is hit that was not
 * hit before.
 */
public record DispositionChange(
    DispositionState previousState,
    DispositionState newState,
    RiskTier previousTier,
    RiskTier newTier,
    Integer previousScore,
    int newScore,
    Set<ListSource> newHardBlockHits,
    boolean material,
    AlertReason alertReason
) {
    public DispositionChange {
        newHardBlockHits = newHardBlockHits == null || newHardBlockHits.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ListSource.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(newHardBlockHits));
    }

    public static DispositionChange between(Disposition previous, RiskAssessment assessment) {
        DispositionState newState = DispositionState.from(assessment.decision());

        boolean flagsChanged = false;
        for (ListSource source : ListSource.values()) {
            if (previous.isHit(source) != assessment.isHit(source)) {
                flagsChanged = true;
                break;
            }
        }

        boolean material = previous.getState() != newState
                || previous.getTier() != assessment.tier()
                || previous.getScore() == null
                || previous.getScore() != assessment.score()
                || flagsChanged;

        EnumSet<ListSource> newHardBlockHits = EnumSet.noneOf(ListSource.class);
        for (ListSource source : assessment.hardBlockHits()) {
            if (!previous.isHit(source)) {
                newHardBlockHits.add(source);
            }
        }

        boolean newlyRejected = previous.getState() != DispositionState.REJECTED
                && newState == DispositionState.REJECTED;

        AlertReason reason = null;
        if (newlyRejected && !newHardBlockHits.isEmpty()) {
            reason = AlertReason.REJECTED_WITH_NEW_HARD_BLOCK_HIT;
        } else if (newlyRejected) {
            reason = AlertReason.NEWLY_REJECTED;
        } else if (!newHardBlockHits.isEmpty()) {
            reason = AlertReason.NEW_HARD_BLOCK_HIT;
        }

        return new DispositionChange(
                previous.getState(),
                newState,
                previous.getTier(),
                assessment.tier(),
                previous.getScore(),
                assessment.score(),
                newHardBlockHits,
                material,
                reason
        );
    }

    public boolean alertWorthy() {
        return alertReason != null;
    }
}
