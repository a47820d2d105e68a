package com.screening.engine;

import com.screening.engine.snapshot.SnapshotSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one identity through the whole pipeline:
 * normalize, match every source, aggregate, classify.
 *
 * Stateless apart from its configuration. Sources are isolated: a failing
 * matcher produces an error result for its source and the others still run.
 */
@Slf4j
public class ScreeningEngine {

    private final Map<ListSource, SourceMatcher> matchers;
    private final Classifier classifier;
    private final Clock clock;

    public ScreeningEngine(List<SourceMatcher> matchers, Classifier classifier, Clock clock) {
        this.matchers = new EnumMap<>(ListSource.class);
        for (SourceMatcher matcher : matchers) {
            if (this.matchers.putIfAbsent(matcher.source(), matcher) != null) {
                throw new IllegalArgumentException("Duplicate matcher for source " + matcher.source());
            }
        }
        this.classifier = classifier;
        this.clock = clock;
    }

    public RiskAssessment screen(IdentityRecord identity, SnapshotSet snapshots) {
        NormalizedName name = identity.normalizedName();

        Map<ListSource, MatchResult> perSource = new EnumMap<>(ListSource.class);
        for (ListSource source : ListSource.values()) {
            perSource.put(source, matchSafely(source, identity, name, snapshots));
        }

        int score = ScoreAggregator.aggregate(perSource);
        Set<ListSource> hardBlockHits = classifier.hardBlockHits(perSource);
        Classification classification = Classifier.classify(score, !hardBlockHits.isEmpty());

        log.debug("Screened identity: score={}, tier={}, decision={}, hardBlockHits={}",
                score, classification.tier(), classification.decision(), hardBlockHits);

        return new RiskAssessment(
                score,
                classification.tier(),
                classification.decision(),
                buildAlerts(perSource),
                perSource,
                hardBlockHits,
                snapshots.version(),
                clock.instant()
        );
    }

    private MatchResult matchSafely(ListSource source, IdentityRecord identity, NormalizedName name,
                                    SnapshotSet snapshots) {
        SourceMatcher matcher = matchers.get(source);
        if (matcher == null) {
            return MatchResult.failed(source.label() + ": no matcher configured");
        }
        try {
            return matcher.match(identity, name, snapshots.get(source));
        } catch (RuntimeException e) {
            log.warn("Matcher for {} failed, marking source as unavailable", source, e);
            return MatchResult.failed(source.label() + " lookup failed: " + e.getMessage());
        }
    }

    private List<String> buildAlerts(Map<ListSource, MatchResult> perSource) {
        List<String> alerts = new ArrayList<>();
        perSource.forEach((source, result) -> {
            if (result.found()) {
                String suffix = classifier.isHardBlock(source) ? " (hard block)" : "";
                alerts.add(String.format("%s: %d match(es) found%s", source.label(), result.total(), suffix));
            }
            if (result.error() != null) {
                alerts.add(String.format("%s: lookup failed, result not authoritative (%s)",
                        source.label(), result.error()));
            } else if (result.provenance() == Provenance.FALLBACK) {
                alerts.add(String.format("%s: fallback reference list used, result not authoritative",
                        source.label()));
            }
        });
        return alerts;
    }
}
