package com.screening.engine;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-text names into comparable form.
 *
 * Lower-cases, strips diacritics (NFD decomposition, combining marks removed)
 * and collapses whitespace. Tokens are the pieces longer than two characters,
 * so particles like "de", "la" or "y" never drive a match on their own.
 */
public final class NameNormalizer {

    static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");

    private NameNormalizer() {
    }

    /**
     * Normalize one or more name parts, joined by a single space.
     * Null and blank parts are ignored.
     */
    public static NormalizedName normalize(String... parts) {
        String text = normalizeText(parts);
        List<String> tokens = text.isEmpty()
                ? List.of()
                : Arrays.stream(text.split(" "))
                        .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                        .toList();
        return new NormalizedName(text, tokens);
    }

    /**
     * Normalized text only, used for reference entries where tokens are not needed.
     */
    public static String normalizeText(String... parts) {
        if (parts == null) {
            return "";
        }
        String joined = Arrays.stream(parts)
                .filter(Objects::nonNull)
                .filter(part -> !part.isBlank())
                .collect(Collectors.joining(" "));

        String decomposed = Normalizer.normalize(joined.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
