package com.screening.event;

import java.time.Instant;
import java.util.List;

/**
 * Emitted by the upstream list refresher after it rewrote one or more snapshot files.
 */
public record WatchlistSnapshotRefreshed(
    String refreshId,      // Unique per refresh run, used for deduplication
    List<String> sources,  // Snapshot names that changed; informational
    Instant timestamp
) {
    public WatchlistSnapshotRefreshed {
        if (refreshId == null || refreshId.isBlank()) {
            throw new IllegalArgumentException("Refresh ID cannot be null or empty");
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
