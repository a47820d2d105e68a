package com.screening.service;

import com.screening.engine.ListSource;
import com.screening.engine.RiskAssessment;
import com.screening.model.Disposition;
import com.screening.model.DispositionState;
import com.screening.model.ScreeningAlert.AlertReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispositionChange")
class DispositionChangeTest {

    private static Disposition storedFrom(RiskAssessment assessment) {
        Disposition disposition = Disposition.pending("S-1");
        disposition.setState(DispositionState.from(assessment.decision()));
        disposition.setTier(assessment.tier());
        disposition.setScore(assessment.score());
        for (ListSource source : ListSource.values()) {
            disposition.setHit(source, assessment.isHit(source));
        }
        return disposition;
    }

    @Test
    @DisplayName("Should treat the first screening of a pending subject as material but not alert-worthy when clean")
    void shouldApproveFromPending() {
        DispositionChange change = DispositionChange.between(Disposition.pending("S-1"), Assessments.clean());

        assertThat(change.material()).isTrue();
        assertThat(change.newState()).isEqualTo(DispositionState.APPROVED);
        assertThat(change.alertWorthy()).isFalse();
    }

    @Test
    @DisplayName("Should alert when a pending subject is rejected on its first screening")
    void shouldAlertWhenRejectedFromPending() {
        DispositionChange change = DispositionChange.between(Disposition.pending("S-1"),
                Assessments.withHits(ListSource.OFAC, ListSource.UN_SECURITY_COUNCIL));

        assertThat(change.alertReason()).isEqualTo(AlertReason.NEWLY_REJECTED);
        assertThat(change.previousState()).isEqualTo(DispositionState.PENDING);
    }

    @Test
    @DisplayName("Should see no material change for an identical assessment")
    void shouldDetectNoChange() {
        RiskAssessment assessment = Assessments.withHits(ListSource.PEP);

        DispositionChange change = DispositionChange.between(storedFrom(assessment), assessment);

        assertThat(change.material()).isFalse();
        assertThat(change.alertWorthy()).isFalse();
    }

    @Test
    @DisplayName("Should see a flag change as material even when state and score stay")
    void shouldDetectFlagChange() {
        // OFAC and UN weigh the same, so state, tier and score are unchanged
        Disposition stored = storedFrom(Assessments.withHits(ListSource.OFAC));

        DispositionChange change = DispositionChange.between(stored, Assessments.withHits(ListSource.UN_SECURITY_COUNCIL));

        assertThat(change.material()).isTrue();
        assertThat(change.alertWorthy()).isFalse();
    }

    @Test
    @DisplayName("Should alert once when an approved subject hits a hard-block list")
    void shouldAlertOnNewHardBlockRejection() {
        Disposition stored = storedFrom(Assessments.clean());

        DispositionChange change = DispositionChange.between(stored, Assessments.withHits(ListSource.DOMESTIC_BLOCKED));

        assertThat(change.newState()).isEqualTo(DispositionState.REJECTED);
        assertThat(change.alertReason()).isEqualTo(AlertReason.REJECTED_WITH_NEW_HARD_BLOCK_HIT);
        assertThat(change.newHardBlockHits()).containsExactly(ListSource.DOMESTIC_BLOCKED);
    }

    @Test
    @DisplayName("Should alert on a new hard-block hit for a subject that was already rejected")
    void shouldAlertOnNewHardBlockWhileRejected() {
        Disposition stored = storedFrom(Assessments.withHits(ListSource.OFAC, ListSource.UN_SECURITY_COUNCIL));

        DispositionChange change = DispositionChange.between(stored,
                Assessments.withHits(ListSource.OFAC, ListSource.UN_SECURITY_COUNCIL, ListSource.DOMESTIC_BLOCKED));

        assertThat(change.previousState()).isEqualTo(DispositionState.REJECTED);
        assertThat(change.alertReason()).isEqualTo(AlertReason.NEW_HARD_BLOCK_HIT);
    }

    @Test
    @DisplayName("Should stay silent for a subject already rejected with the same hard-block hit")
    void shouldNotRepeatAlert() {
        RiskAssessment assessment = Assessments.withHits(ListSource.DOMESTIC_BLOCKED);
        Disposition stored = storedFrom(assessment);

        DispositionChange change = DispositionChange.between(stored, Assessments.withHits(ListSource.DOMESTIC_BLOCKED, ListSource.PEP));

        assertThat(change.material()).isTrue();
        assertThat(change.alertWorthy()).isFalse();
    }

    @Test
    @DisplayName("Should not alert when a subject leaves REJECTED")
    void shouldNotAlertOnImprovement() {
        Disposition stored = storedFrom(Assessments.withHits(ListSource.DOMESTIC_BLOCKED));

        DispositionChange change = DispositionChange.between(stored, Assessments.clean());

        assertThat(change.newState()).isEqualTo(DispositionState.APPROVED);
        assertThat(change.alertWorthy()).isFalse();
    }
}
