package com.screening.service;

import com.screening.config.KafkaTopics;
import com.screening.config.RedisConfig;
import com.screening.engine.ListSource;
import com.screening.engine.RiskAssessment;
import com.screening.event.ScreeningAlertRaised;
import com.screening.model.Disposition;
import com.screening.model.DispositionState;
import com.screening.model.OutboxEvent;
import com.screening.model.ScreeningAlert;
import com.screening.repository.DispositionRepository;
import com.screening.repository.OutboxEventRepository;
import com.screening.repository.ScreeningAlertRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies screening results to stored dispositions.
 *
 * STATE MACHINE:
 * ==============
 * PENDING -> APPROVED | MANUAL_REVIEW | REJECTED, then free movement among
 * the three. The new state is always the decision of the latest assessment.
 *
 * MATERIAL CHANGE:
 * ----------------
 * Any difference in state, tier, score or per-source hit flags. An assessment
 * without a material change writes nothing, so rescreening against an
 * unchanged snapshot set is a no-op (lastScreenedAt stays as it was).
 *
 * ALERTS:
 * -------
 * Raised when the subject becomes REJECTED, or when a hard-block source hits
 * that did not hit before. A subject already REJECTED with the same hits stays
 * silent. Each alert writes:
 * 1. a ScreeningAlert audit row (before and after state)
 * 2. an OutboxEvent carrying ScreeningAlertRaised
 *
 * TRANSACTION:
 * ------------
 * Disposition upsert, audit row and outbox row commit together. The cached
 * disposition is evicted after commit (the cache manager is transaction aware).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispositionTracker {

    private final DispositionRepository dispositionRepository;
    private final ScreeningAlertRepository alertRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    /**
     * Create the PENDING disposition of a newly registered subject, if absent.
     */
    @Transactional
    public Disposition initialize(String subjectId) {
        return dispositionRepository.findById(subjectId)
                .orElseGet(() -> dispositionRepository.save(Disposition.pending(subjectId)));
    }

    /**
     * Apply an assessment to the subject's disposition.
     *
     * @return whether the row was written and which alert, if any, was raised
     */
    @Transactional
    @CacheEvict(value = RedisConfig.DISPOSITIONS_CACHE, key = "#subjectId")
    public DispositionOutcome apply(String subjectId, RiskAssessment assessment) {
        Disposition disposition = dispositionRepository.findById(subjectId)
                .orElseGet(() -> Disposition.pending(subjectId));

        DispositionChange change = DispositionChange.between(disposition, assessment);
        if (!change.material()) {
            log.debug("No material change for subject {}, disposition {} kept", subjectId, disposition.getState());
            return DispositionOutcome.unchanged(disposition);
        }

        disposition.setState(change.newState());
        disposition.setTier(assessment.tier());
        disposition.setScore(assessment.score());
        for (ListSource source : ListSource.values()) {
            disposition.setHit(source, assessment.isHit(source));
        }
        disposition.setLastScreenedAt(assessment.evaluatedAt());
        disposition.setSnapshotVersion(assessment.snapshotVersion());
        // An active alert stays raised while the subject remains rejected
        disposition.setAlertActive(change.alertWorthy()
                || (disposition.isAlertActive() && change.newState() == DispositionState.REJECTED));

        Disposition saved = dispositionRepository.save(disposition);
        log.info("Disposition of subject {} changed: {} -> {} (score {} -> {})",
                subjectId, change.previousState(), change.newState(), change.previousScore(), change.newScore());

        if (!change.alertWorthy()) {
            return new DispositionOutcome(saved, true, null);
        }

        ScreeningAlert alert = raiseAlert(subjectId, change, assessment);
        return new DispositionOutcome(saved, true, alert);
    }

    private ScreeningAlert raiseAlert(String subjectId, DispositionChange change, RiskAssessment assessment) {
        List<String> newHardBlockSources = change.newHardBlockHits().stream()
                .map(ListSource::name)
                .collect(Collectors.toList());

        ScreeningAlert alert = new ScreeningAlert();
        alert.setAlertId(UUID.randomUUID().toString());
        alert.setSubjectId(subjectId);
        alert.setReason(change.alertReason());
        alert.setPreviousState(change.previousState());
        alert.setNewState(change.newState());
        alert.setPreviousTier(change.previousTier());
        alert.setNewTier(change.newTier());
        alert.setPreviousScore(change.previousScore());
        alert.setNewScore(change.newScore());
        alert.setNewHardBlockSources(newHardBlockSources.isEmpty() ? null : String.join(",", newHardBlockSources));
        alert.setDetails(truncate(String.join("; ", assessment.alerts()), 2000));
        alert.setSnapshotVersion(assessment.snapshotVersion());
        alert.setRaisedAt(assessment.evaluatedAt());
        ScreeningAlert saved = alertRepository.save(alert);

        ScreeningAlertRaised event = new ScreeningAlertRaised(
                saved.getAlertId(),
                subjectId,
                change.alertReason().name(),
                change.previousState(),
                change.newState(),
                change.previousTier(),
                change.newTier(),
                change.previousScore(),
                change.newScore(),
                newHardBlockSources,
                assessment.alerts(),
                assessment.snapshotVersion(),
                assessment.evaluatedAt()
        );

        try {
            saveToOutbox(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert for outbox: {}", saved.getAlertId(), e);
            throw new IllegalStateException("Failed to save alert event to outbox", e);
        }

        log.warn("Alert {} raised for subject {}: {} ({} -> {})",
                saved.getAlertId(), subjectId, change.alertReason(), change.previousState(), change.newState());
        return saved;
    }

    private void saveToOutbox(ScreeningAlertRaised event) throws JsonProcessingException {
        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(event.alertId());
        outboxEvent.setEventType(OutboxEventPublisher.ALERT_EVENT_TYPE);
        outboxEvent.setEventKey(event.subjectId());
        outboxEvent.setPayload(objectMapper.writeValueAsString(event));
        outboxEvent.setTopic(KafkaTopics.SCREENING_ALERT_RAISED);
        outboxEventRepository.save(outboxEvent);
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
