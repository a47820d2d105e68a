package com.screening.engine;

import java.util.List;

/**
 * Canonical form of a name: the normalized text and the tokens usable for matching.
 */
public record NormalizedName(String text, List<String> tokens) {

    public NormalizedName {
        text = text == null ? "" : text;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * A name without any token longer than two characters cannot match anything.
     */
    public boolean isMatchable() {
        return !tokens.isEmpty();
    }
}
