package com.screening.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transactional outbox row.
 *
 * Alert events are written here in the same transaction as the disposition
 * and the alert audit row, and published to Kafka later by
 * {@link com.screening.service.OutboxEventPublisher}. If the disposition
 * commits, the alert is delivered eventually; if it rolls back, no alert leaves.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_published", columnList = "published"),
           @Index(name = "idx_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Business identifier of the event (alert id). */
    @Column(nullable = false)
    private String eventId;

    @Column(nullable = false)
    private String eventType;

    /** Kafka record key, keeps all events of a subject on one partition. */
    private String eventKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
