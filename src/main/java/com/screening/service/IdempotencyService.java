package com.screening.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-based deduplication of inbound events.
 *
 * Key pattern: {@code idempotency:{eventType}:{eventId}}, written with
 * SET NX and a 7 day TTL (the default Kafka retention).
 *
 * If Redis is down the event is treated as new (fail open). For snapshot
 * refresh events a duplicate only costs one extra reload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private static final Duration IDEMPOTENCY_TTL = Duration.ofDays(7);
    private static final String IDEMPOTENCY_PREFIX = "idempotency:";

    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * Atomically claim an event.
     *
     * @return true if this is the first time the event is seen, false if it is a duplicate
     */
    public boolean tryAcquire(String eventType, String eventId, String consumerName) {
        String key = buildKey(eventType, eventId);
        try {
            String value = String.format("%s:%d", consumerName, System.currentTimeMillis());
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, value, IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Marked event as processed: {}:{} by {}", eventType, eventId, consumerName);
                return true;
            }
            log.warn("Event already processed: {}:{}", eventType, eventId);
            return false;

        } catch (Exception e) {
            log.error("Redis error claiming event, treating as NOT processed: {}:{}", eventType, eventId, e);
            return true;
        }
    }

    private String buildKey(String eventType, String eventId) {
        return IDEMPOTENCY_PREFIX + eventType + ":" + eventId;
    }
}
