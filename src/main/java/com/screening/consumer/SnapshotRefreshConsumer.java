package com.screening.consumer;

import com.screening.config.KafkaTopics;
import com.screening.engine.snapshot.SnapshotRegistry;
import com.screening.engine.snapshot.SnapshotSet;
import com.screening.event.WatchlistSnapshotRefreshed;
import com.screening.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Reloads the watchlist snapshots when the upstream refresher announces new files.
 *
 * A rescreen batch already in progress keeps the snapshot set it started with;
 * the reloaded set is picked up by the next screening or batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotRefreshConsumer {

    private static final String EVENT_TYPE = "WatchlistSnapshotRefreshed";

    private final IdempotencyService idempotencyService;
    private final SnapshotRegistry snapshotRegistry;

    @KafkaListener(
            topics = KafkaTopics.WATCHLIST_SNAPSHOT_REFRESHED,
            containerFactory = "snapshotRefreshListenerFactory"
    )
    public void onSnapshotRefreshed(WatchlistSnapshotRefreshed event) {
        log.info("Received WatchlistSnapshotRefreshed event: {} (sources: {})", event.refreshId(), event.sources());

        if (!idempotencyService.tryAcquire(EVENT_TYPE, event.refreshId(), "SnapshotRefreshConsumer")) {
            log.warn("Snapshot refresh already handled, skipping: {}", event.refreshId());
            return;
        }

        SnapshotSet reloaded = snapshotRegistry.refresh();
        log.info("Snapshot refresh {} applied, active version: {}", event.refreshId(), reloaded.version());
    }
}
