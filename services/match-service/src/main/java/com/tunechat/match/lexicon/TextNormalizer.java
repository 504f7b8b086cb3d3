package com.tunechat.match.lexicon;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern APOSTROPHES = Pattern.compile("['‘’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]|_");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Lowercases, drops apostrophes, turns every other punctuation mark into a space and collapses
     * whitespace. Null becomes the empty string.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String value = text.toLowerCase(Locale.ROOT);
        value = APOSTROPHES.matcher(value).replaceAll("");
        value = NON_WORD.matcher(value).replaceAll(" ");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public static List<String> words(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }
}
