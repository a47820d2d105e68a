package com.screening.engine;

import com.screening.model.DecisionStatus;
import com.screening.model.RiskTier;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of screening one identity against one snapshot set.
 *
 * {@code decision} depends only on {@code score} and whether a hard-block
 * source was hit; {@code evaluatedAt} is informational.
 */
public record RiskAssessment(
    int score,
    RiskTier tier,
    DecisionStatus decision,
    List<String> alerts,
    Map<ListSource, MatchResult> perSource,
    Set<ListSource> hardBlockHits,
    String snapshotVersion,
    Instant evaluatedAt
) {
    public RiskAssessment {
        if (score < 0 || score > ScoreAggregator.MAX_SCORE) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        if (tier == null || decision == null) {
            throw new IllegalArgumentException("Tier and decision cannot be null");
        }
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        EnumMap<ListSource, MatchResult> results = new EnumMap<>(ListSource.class);
        if (perSource != null) {
            results.putAll(perSource);
        }
        perSource = Collections.unmodifiableMap(results);
        hardBlockHits = hardBlockHits == null || hardBlockHits.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ListSource.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(hardBlockHits));
    }

    public boolean isHit(ListSource source) {
        MatchResult result = perSource.get(source);
        return result != null && result.found();
    }

    /** True when at least one source could not give an authoritative answer. */
    public boolean isDegraded() {
        return perSource.values().stream().anyMatch(result -> !result.isAuthoritative());
    }
}
