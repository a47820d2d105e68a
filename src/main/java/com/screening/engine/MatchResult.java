package com.screening.engine;

import java.util.List;

/**
 * Outcome of matching one identity against one source.
 *
 * Every field is always present. {@code found} implies {@code total >= 1};
 * a populated {@code error} means the lookup failed and {@code found=false}
 * must not be read as "clean". {@code entries} is capped, {@code total} is not.
 */
public record MatchResult(
    boolean found,
    int total,
    List<MatchedEntry> entries,
    String error,
    Provenance provenance,
    String note
) {
    public MatchResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (provenance == null) {
            throw new IllegalArgumentException("Provenance cannot be null");
        }
        if (found && total < 1) {
            throw new IllegalArgumentException("A found result must have at least one match");
        }
        if (error != null && found) {
            throw new IllegalArgumentException("A failed lookup cannot report matches");
        }
        if (total < entries.size()) {
            throw new IllegalArgumentException("Total cannot be lower than the number of entries");
        }
    }

    public static MatchResult matched(List<ListEntry> matches, int maxEntries,
                                      Provenance provenance, String note) {
        List<MatchedEntry> capped = matches.stream()
                .limit(maxEntries)
                .map(MatchedEntry::from)
                .toList();
        return new MatchResult(!matches.isEmpty(), matches.size(), capped, null, provenance, note);
    }

    public static MatchResult notFound(Provenance provenance, String note) {
        return new MatchResult(false, 0, List.of(), null, provenance, note);
    }

    public static MatchResult failed(String error) {
        return new MatchResult(false, 0, List.of(), error, Provenance.UNAVAILABLE, null);
    }

    /** True when this result can be trusted as an authoritative "clean" or "hit". */
    public boolean isAuthoritative() {
        return error == null && provenance == Provenance.AUTHORITATIVE;
    }
}
