package com.screening.engine;

import com.screening.config.ScreeningEngineConfig;
import com.screening.engine.snapshot.ListSnapshot;
import com.screening.engine.snapshot.SnapshotSet;
import com.screening.model.DecisionStatus;
import com.screening.model.PersonType;
import com.screening.model.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScreeningEngine")
class ScreeningEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T02:00:00Z"), ZoneOffset.UTC);

    private Classifier classifier;
    private ScreeningEngine engine;
    private SnapshotSet snapshots;

    @BeforeEach
    void setUp() {
        classifier = new Classifier(EnumSet.of(ListSource.DOMESTIC_BLOCKED));
        engine = new ScreeningEngine(ScreeningEngineConfig.sourceMatchers(10), classifier, CLOCK);
        snapshots = TestSnapshots.empty("v1")
                .with(ListSource.OFAC, "Vladimir Putin", "Osama bin Laden")
                .with(ListSource.UN_SECURITY_COUNCIL, "Osama bin Laden")
                .with(ListSource.DOMESTIC_BLOCKED, "Juan Pérez López")
                .with(ListSource.PEP, "Juan Pérez López", "María Fernanda Ruiz")
                .withTaxpayers(ListEntry.taxpayer("EFO150101AB1", "Empresa Fantasma del Norte", "Definitivo"))
                .build();
    }

    private static IdentityRecord person(String fullName) {
        return IdentityRecord.of(PersonType.INDIVIDUAL, fullName, null);
    }

    @Test
    @DisplayName("Should approve an identity that appears on no list")
    void shouldApproveCleanIdentity() {
        RiskAssessment assessment = engine.screen(person("Roberto Sánchez Vera"), snapshots);

        assertThat(assessment.score()).isZero();
        assertThat(assessment.tier()).isEqualTo(RiskTier.LOW);
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.APPROVED);
        assertThat(assessment.alerts()).isEmpty();
        assertThat(assessment.perSource()).hasSize(ListSource.values().length);
        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.evaluatedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Should send a single OFAC hit to manual review")
    void shouldReviewSingleSanctionsHit() {
        RiskAssessment assessment = engine.screen(person("Vladimir Putin"), snapshots);

        assertThat(assessment.score()).isEqualTo(40);
        assertThat(assessment.tier()).isEqualTo(RiskTier.MEDIUM);
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.MANUAL_REVIEW);
        assertThat(assessment.isHit(ListSource.OFAC)).isTrue();
        assertThat(assessment.alerts()).containsExactly("OFAC: 1 match(es) found");
    }

    @Test
    @DisplayName("Should reject as HIGH when OFAC and UN hits add up above 70")
    void shouldRejectOnCombinedSanctionsHits() {
        RiskAssessment assessment = engine.screen(person("Osama bin Laden"), snapshots);

        assertThat(assessment.score()).isEqualTo(80);
        assertThat(assessment.tier()).isEqualTo(RiskTier.HIGH);
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.REJECTED);
        assertThat(assessment.hardBlockHits()).isEmpty();
    }

    @Test
    @DisplayName("Should reject as CRITICAL on a domestic blocked list hit, whatever the score")
    void shouldRejectOnHardBlockHit() {
        // Given
        IdentityRecord identity = new IdentityRecord(PersonType.INDIVIDUAL, "Juan", "Pérez", "López", null, null);

        // When
        RiskAssessment assessment = engine.screen(identity, snapshots);

        // Then
        assertThat(assessment.score()).isEqualTo(100);
        assertThat(assessment.tier()).isEqualTo(RiskTier.CRITICAL);
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.REJECTED);
        assertThat(assessment.hardBlockHits()).containsExactly(ListSource.DOMESTIC_BLOCKED);
        assertThat(assessment.alerts()).containsExactly(
                "UIF Personas Bloqueadas: 1 match(es) found (hard block)",
                "PEPs: 1 match(es) found");
    }

    @Test
    @DisplayName("Should check the deregistered registry by RFC")
    void shouldMatchDeregisteredByRfc() {
        IdentityRecord company = IdentityRecord.of(PersonType.LEGAL_ENTITY, "Servicios Integrales", "EFO150101AB1");

        RiskAssessment assessment = engine.screen(company, snapshots);

        assertThat(assessment.isHit(ListSource.DEREGISTERED_ENTITY)).isTrue();
        assertThat(assessment.score()).isEqualTo(50);
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.MANUAL_REVIEW);
    }

    @Test
    @DisplayName("Should keep screening other sources when one source is unavailable")
    void shouldIsolateUnavailableSource() {
        // Given
        SnapshotSet degraded = TestSnapshots.empty("v1")
                .replace(ListSnapshot.unavailable(ListSource.OFAC, "snapshot file is malformed: ofac.json"))
                .with(ListSource.PEP, "María Fernanda Ruiz")
                .build();

        // When
        RiskAssessment assessment = engine.screen(person("María Fernanda Ruiz"), degraded);

        // Then
        MatchResult ofac = assessment.perSource().get(ListSource.OFAC);
        assertThat(ofac.found()).isFalse();
        assertThat(ofac.error()).isEqualTo("OFAC unavailable: snapshot file is malformed: ofac.json");
        assertThat(assessment.isHit(ListSource.PEP)).isTrue();
        assertThat(assessment.score()).isEqualTo(30);
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.alerts()).contains(
                "OFAC: lookup failed, result not authoritative (OFAC unavailable: snapshot file is malformed: ofac.json)");
    }

    @Test
    @DisplayName("Should turn a matcher exception into an error result for that source only")
    void shouldIsolateMatcherFailure() {
        // Given
        List<SourceMatcher> matchers = new ArrayList<>(ScreeningEngineConfig.sourceMatchers(10));
        matchers.removeIf(m -> m.source() == ListSource.OFAC);
        matchers.add(new SourceMatcher() {
            @Override
            public ListSource source() {
                return ListSource.OFAC;
            }

            @Override
            public MatchResult match(IdentityRecord identity, NormalizedName name, ListSnapshot snapshot) {
                throw new IllegalStateException("index corrupted");
            }
        });
        ScreeningEngine failing = new ScreeningEngine(matchers, classifier, CLOCK);

        // When
        RiskAssessment assessment = failing.screen(person("Juan Pérez López"), snapshots);

        // Then
        assertThat(assessment.perSource().get(ListSource.OFAC).error())
                .isEqualTo("OFAC lookup failed: index corrupted");
        assertThat(assessment.isHit(ListSource.DOMESTIC_BLOCKED)).isTrue();
        assertThat(assessment.decision()).isEqualTo(DecisionStatus.REJECTED);
    }

    @Test
    @DisplayName("Should mark fallback results in the alerts")
    void shouldMarkFallback() {
        SnapshotSet withFallback = TestSnapshots.empty("v1")
                .replace(ListSnapshot.fallback(ListSource.OFAC, "snapshot file not found: ofac.json",
                        List.of(ListEntry.named(ListSource.OFAC, "Vladimir Putin"))))
                .build();

        RiskAssessment assessment = engine.screen(person("Vladimir Putin"), withFallback);

        assertThat(assessment.perSource().get(ListSource.OFAC).provenance()).isEqualTo(Provenance.FALLBACK);
        assertThat(assessment.alerts()).containsExactly(
                "OFAC: 1 match(es) found",
                "OFAC: fallback reference list used, result not authoritative");
        assertThat(assessment.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should produce identical assessments for identical input")
    void shouldBeDeterministic() {
        IdentityRecord identity = person("Juan Pérez López");

        assertThat(engine.screen(identity, snapshots)).isEqualTo(engine.screen(identity, snapshots));
    }

    @Test
    @DisplayName("Should record the composite snapshot version")
    void shouldRecordSnapshotVersion() {
        RiskAssessment assessment = engine.screen(person("Roberto Sánchez"), snapshots);

        assertThat(assessment.snapshotVersion()).startsWith("ofac@v1;").contains("pep@v1");
    }

    @Test
    @DisplayName("Should refuse two matchers for the same source")
    void shouldRejectDuplicateMatchers() {
        List<SourceMatcher> matchers = new ArrayList<>(ScreeningEngineConfig.sourceMatchers(10));
        matchers.add(new NameTokenMatcher(ListSource.PEP, 10));

        assertThatThrownBy(() -> new ScreeningEngine(matchers, classifier, CLOCK))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
