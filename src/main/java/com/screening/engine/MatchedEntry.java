package com.screening.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A list entry as exposed in a match result: its name plus the
 * source-specific metadata it carries.
 */
public record MatchedEntry(String name, Map<String, String> metadata) {

    public MatchedEntry {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static MatchedEntry from(ListEntry entry) {
        Map<String, String> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "uid", entry.uid());
        putIfPresent(metadata, "category", entry.category());
        putIfPresent(metadata, "inclusionDate", entry.inclusionDate());
        putIfPresent(metadata, "position", entry.position());
        putIfPresent(metadata, "institution", entry.institution());
        putIfPresent(metadata, "taxId", entry.taxId());
        return new MatchedEntry(entry.fullName(), metadata);
    }

    private static void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
