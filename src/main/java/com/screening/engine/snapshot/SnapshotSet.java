package com.screening.engine.snapshot;

import com.screening.engine.ListSource;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One consistent set of snapshots, one per source.
 *
 * A batch run holds on to a single instance for its whole duration, so every
 * subject in the batch is screened against the same data.
 */
public record SnapshotSet(Map<ListSource, ListSnapshot> snapshots, Instant loadedAt) {

    public SnapshotSet {
        EnumMap<ListSource, ListSnapshot> copy = new EnumMap<>(ListSource.class);
        if (snapshots != null) {
            copy.putAll(snapshots);
        }
        snapshots = Collections.unmodifiableMap(copy);
    }

    /**
     * Snapshot of the given source; an unavailable one when the set has none.
     */
    public ListSnapshot get(ListSource source) {
        ListSnapshot snapshot = snapshots.get(source);
        return snapshot != null ? snapshot : ListSnapshot.unavailable(source, "no snapshot configured");
    }

    /**
     * Composite version, e.g. {@code ofac@2026-10-18;pep@builtin}.
     */
    public String version() {
        return snapshots.values().stream()
                .map(s -> s.getSource().snapshotName() + "@" + s.getVersion())
                .collect(Collectors.joining(";"));
    }
}
