package com.screening.engine.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.screening.config.ScreeningProperties;
import com.screening.engine.ListEntry;
import com.screening.engine.ListSource;
import com.screening.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads reference list snapshots from the snapshot directory.
 *
 * Layout: one {@code <name>.json} array per source plus an optional
 * {@code <name>.metadata.json} carrying the refresh timestamp used as version.
 * When there is no metadata the file modification time is the version.
 *
 * Loading never throws. A missing or malformed file produces an unavailable
 * snapshot for that source, or a fallback snapshot over the built-in reference
 * list when fallback is enabled and the source has one.
 */
@Component
@Slf4j
public class SnapshotLoader {

    private static final TypeReference<List<SnapshotFileEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ScreeningProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotLoader(ScreeningProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Load every source. Each source is isolated from the others.
     */
    public SnapshotSet loadAll() {
        Map<ListSource, ListSnapshot> snapshots = new EnumMap<>(ListSource.class);
        for (ListSource source : ListSource.values()) {
            snapshots.put(source, load(source));
        }
        return new SnapshotSet(snapshots, clock.instant());
    }

    public ListSnapshot load(ListSource source) {
        try {
            Path file = directory().resolve(source.snapshotName() + ".json");
            List<ListEntry> entries = readEntries(source, file);
            String version = readVersion(source, file);
            log.info("Loaded {} snapshot: {} entries, version {}", source, entries.size(), version);
            return ListSnapshot.authoritative(source, version, entries);
        } catch (SourceUnavailableException e) {
            return degraded(source, e.getMessage());
        } catch (RuntimeException e) {
            // Bad directory setting, unreadable path, unexpected row content
            log.error("Unexpected failure loading {} snapshot", source, e);
            return degraded(source, "snapshot cannot be read: " + e.getMessage());
        }
    }

    private List<ListEntry> readEntries(ListSource source, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SourceUnavailableException(source, "snapshot file not found: " + file.getFileName());
        }

        List<SnapshotFileEntry> rows;
        try {
            rows = objectMapper.readValue(file.toFile(), ENTRY_LIST);
        } catch (IOException e) {
            throw new SourceUnavailableException(source,
                    "snapshot file is malformed: " + file.getFileName(), e);
        }
        if (rows == null) {
            throw new SourceUnavailableException(source, "snapshot file is empty: " + file.getFileName());
        }

        List<ListEntry> entries = rows.stream()
                .filter(row -> row != null && row.isUsable())
                .map(row -> toEntry(source, row))
                .toList();

        if (entries.size() < rows.size()) {
            log.debug("Skipped {} unusable rows in {} snapshot", rows.size() - entries.size(), source);
        }
        return entries;
    }

    private String readVersion(ListSource source, Path file) {
        Path metadataFile = file.resolveSibling(source.snapshotName() + ".metadata.json");
        if (Files.isRegularFile(metadataFile)) {
            try {
                SnapshotMetadata metadata = objectMapper.readValue(metadataFile.toFile(), SnapshotMetadata.class);
                if (metadata != null && metadata.updatedAt() != null && !metadata.updatedAt().isBlank()) {
                    return metadata.updatedAt();
                }
            } catch (IOException e) {
                log.warn("Ignoring unreadable metadata for {} snapshot: {}", source, e.getMessage());
            }
        }
        try {
            return Files.getLastModifiedTime(file).toInstant().toString();
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "cannot stat snapshot file: " + file.getFileName(), e);
        }
    }

    private ListSnapshot degraded(ListSource source, String reason) {
        if (properties.getSnapshot().isFallbackEnabled()) {
            List<ListEntry> reference = ReferenceLists.forSource(source);
            if (!reference.isEmpty()) {
                log.warn("{} snapshot unavailable ({}), using built-in reference list of {} entries",
                        source, reason, reference.size());
                return ListSnapshot.fallback(source, reason, reference);
            }
        }
        log.warn("{} snapshot unavailable: {}", source, reason);
        return ListSnapshot.unavailable(source, reason);
    }

    private static ListEntry toEntry(ListSource source, SnapshotFileEntry row) {
        return new ListEntry(
                source,
                row.uid(),
                row.fullName(),
                null,
                row.category(),
                row.inclusionDate(),
                row.position(),
                row.institution(),
                row.taxId()
        );
    }

    private Path directory() {
        return Paths.get(properties.getSnapshot().getDirectory());
    }
}
