package com.screening.engine;

import java.util.Map;

/**
 * Composite score: sum of the weights of every source with a hit, capped at 100.
 */
public final class ScoreAggregator {

    public static final int MAX_SCORE = 100;

    private ScoreAggregator() {
    }

    public static int aggregate(Map<ListSource, MatchResult> perSource) {
        int score = 0;
        for (Map.Entry<ListSource, MatchResult> entry : perSource.entrySet()) {
            if (entry.getValue() != null && entry.getValue().found()) {
                score += entry.getKey().weight();
            }
        }
        return Math.min(MAX_SCORE, score);
    }
}
