package com.screening.engine;

import com.screening.engine.snapshot.ListSnapshot;

/**
 * Conjunctive token match: a candidate matches when every query token is a
 * substring of its normalized name. Order of tokens does not matter.
 *
 * Recall over precision. "juan perez" matches "juan perez gomez" and also
 * "perezoso juanito"; every hit goes to a human anyway.
 */
public class NameTokenMatcher extends AbstractSourceMatcher {

    static final String UNMATCHABLE_NOTE = "name has no token longer than 2 characters, cannot match";

    public NameTokenMatcher(ListSource source, int maxEntries) {
        super(source, maxEntries);
    }

    @Override
    protected MatchResult matchAvailable(IdentityRecord identity, NormalizedName name, ListSnapshot snapshot) {
        if (!name.isMatchable()) {
            return noMatch(snapshot, UNMATCHABLE_NOTE);
        }
        return result(snapshot.findContainingAll(name.tokens()), snapshot, null);
    }
}
