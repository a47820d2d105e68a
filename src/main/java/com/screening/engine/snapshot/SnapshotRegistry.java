package com.screening.engine.snapshot;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot set currently used for screening.
 *
 * A refresh swaps the whole set atomically. Callers that need consistency
 * across many screenings (a batch run) take one reference via {@link #current()}
 * and keep using it; they never observe a half-refreshed set.
 */
@Component
@Slf4j
public class SnapshotRegistry {

    private final SnapshotLoader loader;
    private final AtomicReference<SnapshotSet> current = new AtomicReference<>();

    public SnapshotRegistry(SnapshotLoader loader) {
        this.loader = loader;
    }

    @PostConstruct
    void initialize() {
        refresh();
    }

    public SnapshotSet current() {
        SnapshotSet set = current.get();
        return set != null ? set : refresh();
    }

    public synchronized SnapshotSet refresh() {
        SnapshotSet loaded = loader.loadAll();
        SnapshotSet previous = current.getAndSet(loaded);
        if (previous == null || !previous.version().equals(loaded.version())) {
            log.info("Active watchlist snapshot version: {}", loaded.version());
        } else {
            log.debug("Watchlist snapshot reloaded, version unchanged: {}", loaded.version());
        }
        return loaded;
    }
}
