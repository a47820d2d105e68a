package com.screening.producer;

import com.screening.config.KafkaTopics;
import com.screening.event.ScreeningAlertRaised;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes screening events to Kafka.
 *
 * Only the outbox publisher calls this; business code writes to the outbox.
 * The returned future completes when the broker acknowledges.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * Publish a ScreeningAlertRaised event keyed by subject id.
     */
    public CompletableFuture<SendResult<String, Object>> publishAlert(ScreeningAlertRaised event) {
        log.info("Publishing ScreeningAlertRaised event: {} for subject {}", event.alertId(), event.subjectId());

        CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(KafkaTopics.SCREENING_ALERT_RAISED, event.subjectId(), event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish ScreeningAlertRaised event: {}", event.alertId(), ex);
            } else {
                log.info("Published ScreeningAlertRaised event: {} to partition {}",
                        event.alertId(), result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
