package com.screening.engine;

import com.screening.engine.snapshot.ListSnapshot;

/**
 * Finds candidate matches for an identity in one source's snapshot.
 */
public interface SourceMatcher {

    ListSource source();

    /**
     * Never throws for data reasons; an unusable snapshot yields a result with
     * {@code error} populated.
     */
    MatchResult match(IdentityRecord identity, NormalizedName name, ListSnapshot snapshot);
}
