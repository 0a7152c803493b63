package com.venuepulse.common.text;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases text, replaces punctuation with spaces and collapses whitespace, so that
 * phrase lookups and duplicate detection ignore formatting differences.
 */
public final class TextNormalizer {

    private static final Pattern NON_WORD   = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {}

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String spaced = NON_WORD.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /** Words of already-normalized text. */
    public static List<String> words(String normalized) {
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    /**
     * Whole-word phrase match on normalized input: {@code "beer"} matches
     * {@code "cold beer here"} but not {@code "beers"}.
     */
    public static boolean containsPhrase(String normalizedText, String normalizedPhrase) {
        if (normalizedPhrase.isEmpty()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }
}
