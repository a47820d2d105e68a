package com.screening.service;

import com.screening.event.ScreeningAlertRaised;
import com.screening.model.OutboxEvent;
import com.screening.producer.EventProducer;
import com.screening.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Delivers ScreeningAlertRaised rows written by DispositionTracker to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Polls every screening.outbox.poll-interval-ms (default 500ms)
 * 2. Reads up to 100 unpublished rows in creation order
 * 3. For each row: deserialize, publish, wait for the acknowledgement,
 *    mark published
 * 4. A failure bumps the retry count and keeps the row for the next poll
 *
 * MONITORING:
 * -----------
 * - Warning per failed attempt, error once a row failed 10 times
 * - Rows unpublished for more than five minutes are reported every minute
 *
 * Running several instances needs a distributed lock (ShedLock or a Redis
 * lock) around {@link #publishEvents()}; without one an alert may be sent twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    static final String ALERT_EVENT_TYPE = "ScreeningAlertRaised";

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRY_COUNT = 10;
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;

    @Scheduled(fixedDelayString = "${screening.outbox.poll-interval-ms:500}")
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEvents(PageRequest.of(0, BATCH_SIZE));
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    private void publishEvent(OutboxEvent outboxEvent) throws Exception {
        if (!ALERT_EVENT_TYPE.equals(outboxEvent.getEventType())) {
            throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        }

        ScreeningAlertRaised event = objectMapper.readValue(outboxEvent.getPayload(), ScreeningAlertRaised.class);

        // Mark published only after the broker acknowledged
        eventProducer.publishAlert(event).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now());
        outboxEventRepository.save(outboxEvent);

        log.info("Published outbox event: {} (type: {})", outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    /**
     * Reports events that have not been published for more than five minutes.
     */
    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now().minusSeconds(300);
            List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} stuck alert events older than 5 minutes", stuckEvents.size());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, eventId={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventId(), event.getCreatedAt(),
                              event.getRetryCount(), event.getLastError())
                );
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > 1000) {
                log.warn("Outbox queue size is {}, which is high", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }
        } catch (Exception e) {
            log.error("Error monitoring stuck events", e);
        }
    }
}
