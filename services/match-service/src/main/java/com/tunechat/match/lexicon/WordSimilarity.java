package com.tunechat.match.lexicon;

final class WordSimilarity {
    static final double DEFAULT_THRESHOLD = 0.8;
    private static final int MIN_WORD_LENGTH = 3;
    private static final int MAX_EDIT_WORD_LENGTH = 6;

    private WordSimilarity() {
    }

    static boolean isSimilar(String phraseWord, String textWord) {
        if (phraseWord.equals(textWord)) {
            return true;
        }
        if (phraseWord.length() < MIN_WORD_LENGTH || textWord.length() < MIN_WORD_LENGTH) {
            return false;
        }
        if (phraseWord.contains(textWord) || textWord.contains(phraseWord)) {
            return true;
        }
        if (phraseWord.length() <= MAX_EDIT_WORD_LENGTH && textWord.length() <= MAX_EDIT_WORD_LENGTH) {
            int distance = levenshtein(phraseWord, textWord);
            int maxLen = Math.max(phraseWord.length(), textWord.length());
            return 1.0 - (double) distance / maxLen >= DEFAULT_THRESHOLD;
        }
        return false;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
