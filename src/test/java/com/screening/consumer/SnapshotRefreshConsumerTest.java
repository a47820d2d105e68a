package com.screening.consumer;

import com.screening.engine.snapshot.SnapshotRegistry;
import com.screening.engine.snapshot.SnapshotSet;
import com.screening.event.WatchlistSnapshotRefreshed;
import com.screening.service.IdempotencyService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SnapshotRefreshConsumer")
class SnapshotRefreshConsumerTest {

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private SnapshotRegistry snapshotRegistry;

    @InjectMocks
    private SnapshotRefreshConsumer consumer;

    private final WatchlistSnapshotRefreshed event =
            new WatchlistSnapshotRefreshed("R-1", List.of("ofac"), Instant.parse("2026-10-19T01:00:00Z"));

    @Test
    @DisplayName("Should reload snapshots on a new refresh event")
    void shouldReload() {
        when(idempotencyService.tryAcquire("WatchlistSnapshotRefreshed", "R-1", "SnapshotRefreshConsumer"))
                .thenReturn(true);
        when(snapshotRegistry.refresh()).thenReturn(new SnapshotSet(Map.of(), Instant.EPOCH));

        consumer.onSnapshotRefreshed(event);

        verify(snapshotRegistry).refresh();
    }

    @Test
    @DisplayName("Should ignore a redelivered refresh event")
    void shouldSkipDuplicate() {
        when(idempotencyService.tryAcquire("WatchlistSnapshotRefreshed", "R-1", "SnapshotRefreshConsumer"))
                .thenReturn(false);

        consumer.onSnapshotRefreshed(event);

        verify(snapshotRegistry, never()).refresh();
    }
}
