package com.screening.engine;

import com.screening.model.DecisionStatus;
import com.screening.model.RiskTier;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps a score and the hard-block flag to a tier and an automatic decision.
 *
 * Decision table, first matching row wins:
 * <pre>
 *   hard-block hit        -> CRITICAL / REJECTED
 *   score  > 70           -> HIGH     / REJECTED
 *   30 <= score <= 70     -> MEDIUM   / MANUAL_REVIEW
 *   otherwise             -> LOW      / APPROVED
 * </pre>
 * Both band bounds are inclusive in MEDIUM: 70 is reviewed, 71 is rejected.
 */
public class Classifier {

    public static final int HIGH_THRESHOLD = 70;
    public static final int REVIEW_LOWER_BOUND = 30;

    private final Set<ListSource> hardBlockSources;

    public Classifier(Set<ListSource> hardBlockSources) {
        this.hardBlockSources = hardBlockSources == null || hardBlockSources.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ListSource.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(hardBlockSources));
    }

    public static Classification classify(int score, boolean hardBlockHit) {
        if (hardBlockHit) {
            return new Classification(RiskTier.CRITICAL, DecisionStatus.REJECTED);
        }
        if (score > HIGH_THRESHOLD) {
            return new Classification(RiskTier.HIGH, DecisionStatus.REJECTED);
        }
        if (score >= REVIEW_LOWER_BOUND) {
            return new Classification(RiskTier.MEDIUM, DecisionStatus.MANUAL_REVIEW);
        }
        return new Classification(RiskTier.LOW, DecisionStatus.APPROVED);
    }

    /**
     * Hard-block sources with a hit in the given results.
     */
    public Set<ListSource> hardBlockHits(Map<ListSource, MatchResult> perSource) {
        EnumSet<ListSource> hits = EnumSet.noneOf(ListSource.class);
        for (ListSource source : hardBlockSources) {
            MatchResult result = perSource.get(source);
            if (result != null && result.found()) {
                hits.add(source);
            }
        }
        return hits;
    }

    public boolean isHardBlock(ListSource source) {
        return hardBlockSources.contains(source);
    }

    public Set<ListSource> getHardBlockSources() {
        return hardBlockSources;
    }
}
