package com.screening.engine.snapshot;

import com.screening.engine.ListEntry;
import com.screening.engine.ListSource;
import com.screening.engine.Provenance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time, read-only copy of one reference list.
 *
 * Entries keep their file order. A trigram index over the normalized names
 * narrows candidates before the substring check, so a lookup does not scan
 * the whole list. Instances are immutable and safe to share between threads.
 */
public final class ListSnapshot {

    private final ListSource source;
    private final Provenance provenance;
    private final String version;
    private final String unavailableReason;
    private final List<ListEntry> entries;
    private final Map<String, List<ListEntry>> byTaxId;
    private final Map<String, BitSet> trigramIndex;

    private ListSnapshot(ListSource source, Provenance provenance, String version,
                         String unavailableReason, List<ListEntry> entries) {
        this.source = source;
        this.provenance = provenance;
        this.version = version;
        this.unavailableReason = unavailableReason;
        this.entries = List.copyOf(entries);
        this.byTaxId = indexByTaxId(this.entries);
        this.trigramIndex = indexTrigrams(this.entries);
    }

    public static ListSnapshot authoritative(ListSource source, String version, List<ListEntry> entries) {
        return new ListSnapshot(source, Provenance.AUTHORITATIVE, version, null, entries);
    }

    /**
     * Snapshot backed by the built-in reference list because the real one could not be loaded.
     */
    public static ListSnapshot fallback(ListSource source, String reason, List<ListEntry> entries) {
        return new ListSnapshot(source, Provenance.FALLBACK, "builtin", reason, entries);
    }

    public static ListSnapshot unavailable(ListSource source, String reason) {
        return new ListSnapshot(source, Provenance.UNAVAILABLE, "none", reason, List.of());
    }

    /**
     * Authoritative snapshot built from plain names.
     */
    public static ListSnapshot of(ListSource source, String version, String... names) {
        return authoritative(source, version, Arrays.stream(names)
                .map(name -> ListEntry.named(source, name))
                .toList());
    }

    public ListSource getSource() {
        return source;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public String getVersion() {
        return version;
    }

    /** Why the authoritative snapshot is missing; null when it was loaded. */
    public String getUnavailableReason() {
        return unavailableReason;
    }

    public List<ListEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isUnavailable() {
        return provenance == Provenance.UNAVAILABLE;
    }

    /**
     * Entries whose normalized name contains every token, in snapshot order.
     * An empty token list matches nothing.
     */
    public List<ListEntry> findContainingAll(List<String> tokens) {
        if (tokens == null || tokens.isEmpty() || entries.isEmpty()) {
            return List.of();
        }

        BitSet candidates = null;
        for (String token : tokens) {
            for (String gram : trigrams(token)) {
                BitSet posting = trigramIndex.get(gram);
                if (posting == null) {
                    return List.of();
                }
                if (candidates == null) {
                    candidates = (BitSet) posting.clone();
                } else {
                    candidates.and(posting);
                }
                if (candidates.isEmpty()) {
                    return List.of();
                }
            }
        }
        if (candidates == null) {
            candidates = new BitSet(entries.size());
            candidates.set(0, entries.size());
        }

        List<ListEntry> matches = new ArrayList<>();
        for (int i = candidates.nextSetBit(0); i >= 0; i = candidates.nextSetBit(i + 1)) {
            ListEntry entry = entries.get(i);
            if (containsAll(entry.normalizedName(), tokens)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public List<ListEntry> findByTaxId(String taxId) {
        if (taxId == null) {
            return List.of();
        }
        return byTaxId.getOrDefault(taxId.toUpperCase(Locale.ROOT), List.of());
    }

    private static boolean containsAll(String name, List<String> tokens) {
        for (String token : tokens) {
            if (!name.contains(token)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, List<ListEntry>> indexByTaxId(List<ListEntry> entries) {
        Map<String, List<ListEntry>> index = new HashMap<>();
        for (ListEntry entry : entries) {
            if (entry.taxId() != null && !entry.taxId().isBlank()) {
                index.computeIfAbsent(entry.taxId().trim().toUpperCase(Locale.ROOT), k -> new ArrayList<>())
                        .add(entry);
            }
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        return Map.copyOf(index);
    }

    private static Map<String, BitSet> indexTrigrams(List<ListEntry> entries) {
        Map<String, BitSet> index = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            for (String gram : trigrams(entries.get(i).normalizedName())) {
                index.computeIfAbsent(gram, k -> new BitSet()).set(i);
            }
        }
        return index;
    }

    static Set<String> trigrams(String text) {
        Set<String> grams = new LinkedHashSet<>();
        for (int i = 0; i + 3 <= text.length(); i++) {
            grams.add(text.substring(i, i + 3));
        }
        return grams;
    }
}
