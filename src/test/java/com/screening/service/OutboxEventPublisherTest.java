package com.screening.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.screening.config.KafkaTopics;
import com.screening.event.ScreeningAlertRaised;
import com.screening.model.DispositionState;
import com.screening.model.OutboxEvent;
import com.screening.model.RiskTier;
import com.screening.producer.EventProducer;
import com.screening.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxEventPublisher")
class OutboxEventPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private EventProducer eventProducer;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxEventPublisher(outboxEventRepository, eventProducer, objectMapper);
    }

    private OutboxEvent alertRow() throws Exception {
        ScreeningAlertRaised event = new ScreeningAlertRaised("A-1", "S-1", "NEWLY_REJECTED",
                DispositionState.MANUAL_REVIEW, DispositionState.REJECTED, RiskTier.MEDIUM, RiskTier.HIGH,
                40, 80, List.of(), List.of("OFAC: 1 match(es) found"), "ofac@v1",
                Instant.parse("2026-10-19T02:00:00Z"));
        OutboxEvent row = new OutboxEvent();
        row.setId(1L);
        row.setEventId("A-1");
        row.setEventType("ScreeningAlertRaised");
        row.setEventKey("S-1");
        row.setTopic(KafkaTopics.SCREENING_ALERT_RAISED);
        row.setPayload(objectMapper.writeValueAsString(event));
        return row;
    }

    @Test
    @DisplayName("Should publish an alert and mark the row published after the acknowledgement")
    void shouldPublishAndMark() throws Exception {
        // Given
        OutboxEvent row = alertRow();
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(row));
        when(eventProducer.publishAlert(any())).thenReturn(CompletableFuture.completedFuture(null));

        // When
        publisher.publishEvents();

        // Then
        ArgumentCaptor<ScreeningAlertRaised> captor = ArgumentCaptor.forClass(ScreeningAlertRaised.class);
        verify(eventProducer).publishAlert(captor.capture());
        assertThat(captor.getValue().alertId()).isEqualTo("A-1");
        assertThat(captor.getValue().newState()).isEqualTo(DispositionState.REJECTED);
        assertThat(row.getPublished()).isTrue();
        assertThat(row.getPublishedAt()).isNotNull();
        verify(outboxEventRepository).save(row);
    }

    @Test
    @DisplayName("Should keep the row unpublished and count the retry when sending fails")
    void shouldRetryOnFailure() throws Exception {
        // Given
        OutboxEvent row = alertRow();
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(row));
        when(eventProducer.publishAlert(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // When
        publisher.publishEvents();

        // Then
        assertThat(row.getPublished()).isFalse();
        assertThat(row.getRetryCount()).isEqualTo(1);
        assertThat(row.getLastError()).contains("broker down");
        verify(outboxEventRepository).save(row);
    }

    @Test
    @DisplayName("Should reject rows of an unknown event type without publishing")
    void shouldRejectUnknownType() throws Exception {
        OutboxEvent row = alertRow();
        row.setEventType("Unknown");
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(row));

        publisher.publishEvents();

        assertThat(row.getPublished()).isFalse();
        assertThat(row.getRetryCount()).isEqualTo(1);
        assertThat(row.getLastError()).contains("Unknown event type");
    }
}
