package com.autolens.insight.resolver;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern NON_SPACING_MARKS = Pattern.compile("\\p{Mn}+");
    private static final Pattern SEPARATORS = Pattern.compile("[/\\-_,;:()\\[\\]]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s.]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern KEY_SEPARATORS = Pattern.compile("[\\s\\-]+");

    private TextNormalizer() {
    }

    /**
     * Folds diacritics, lower-cases and strips punctuation so that every extractor sees the same
     * accent- and punctuation-insensitive text. Periods survive ({@code 1.2}, {@code id.3}).
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = foldDiacritics(text).toLowerCase(Locale.ROOT);
        normalized = SEPARATORS.matcher(normalized).replaceAll(" ");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        normalized = NON_WORD.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }

    public static String foldDiacritics(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return NON_SPACING_MARKS.matcher(decomposed).replaceAll("");
    }

    /** Lookup key for brand tables: {@code "Land-Rover"} and {@code "land rover"} both give {@code land_rover}. */
    public static String tableKey(String value) {
        if (value == null) {
            return "";
        }
        String folded = foldDiacritics(value).trim().toLowerCase(Locale.ROOT);
        return KEY_SEPARATORS.matcher(folded).replaceAll("_");
    }
}
