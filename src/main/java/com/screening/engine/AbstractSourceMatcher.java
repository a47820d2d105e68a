package com.screening.engine;

import com.screening.engine.snapshot.ListSnapshot;

import java.util.List;

/**
 * Handles snapshot availability and provenance marking; subclasses only decide
 * which entries match.
 */
public abstract class AbstractSourceMatcher implements SourceMatcher {

    private final ListSource source;
    private final int maxEntries;

    protected AbstractSourceMatcher(ListSource source, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.source = source;
        this.maxEntries = maxEntries;
    }

    @Override
    public ListSource source() {
        return source;
    }

    @Override
    public final MatchResult match(IdentityRecord identity, NormalizedName name, ListSnapshot snapshot) {
        if (snapshot == null || snapshot.getSource() != source) {
            return MatchResult.failed(source.label() + ": no snapshot for this source");
        }
        if (snapshot.isUnavailable()) {
            return MatchResult.failed(source.label() + " unavailable: " + snapshot.getUnavailableReason());
        }
        return matchAvailable(identity, name, snapshot);
    }

    protected abstract MatchResult matchAvailable(IdentityRecord identity, NormalizedName name,
                                                  ListSnapshot snapshot);

    /**
     * Build the result, marking it when it was computed from the fallback list.
     */
    protected MatchResult result(List<ListEntry> matches, ListSnapshot snapshot, String note) {
        return MatchResult.matched(matches, maxEntries, snapshot.getProvenance(), noteFor(snapshot, note));
    }

    protected MatchResult noMatch(ListSnapshot snapshot, String note) {
        return MatchResult.notFound(snapshot.getProvenance(), noteFor(snapshot, note));
    }

    private static String noteFor(ListSnapshot snapshot, String note) {
        if (snapshot.getProvenance() != Provenance.FALLBACK) {
            return note;
        }
        String fallbackNote = "fallback reference list used (" + snapshot.getUnavailableReason() + ")";
        return note == null ? fallbackNote : fallbackNote + "; " + note;
    }
}
