package com.tunechat.match.lexicon;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Phrase to song-id lookup with exact, partial and fuzzy matching.
 *
 * <p>Readers always see a complete snapshot. {@link #addPhrase} builds a new snapshot and swaps it
 * in, so lookups never block.
 */
public class PhraseLexicon {
    static final int MIN_INDEXED_WORD_LENGTH = 3;
    static final double PARTIAL_MAX_CONFIDENCE = 0.8;
    static final double PARTIAL_MIN_CONFIDENCE = 0.2;
    static final int PARTIAL_LIMIT = 5;
    static final double FUZZY_MIN_OVERLAP = 0.6;
    static final int FUZZY_MIN_MATCHED_WORDS = 2;
    static final double FUZZY_WEIGHT = 0.6;
    static final int FUZZY_LIMIT = 3;

    private final AtomicReference<Snapshot> snapshot;

    public PhraseLexicon(Map<String, ? extends Collection<String>> phraseToSongIds) {
        Map<String, Set<String>> phrases = new LinkedHashMap<>();
        if (phraseToSongIds != null) {
            for (Map.Entry<String, ? extends Collection<String>> entry : phraseToSongIds.entrySet()) {
                String phrase = TextNormalizer.normalize(entry.getKey());
                if (phrase.isEmpty()) {
                    continue;
                }
                phrases.computeIfAbsent(phrase, key -> new LinkedHashSet<>()).addAll(cleanIds(entry.getValue()));
            }
        }
        this.snapshot = new AtomicReference<>(Snapshot.build(phrases));
    }

    public static PhraseLexicon empty() {
        return new PhraseLexicon(Map.of());
    }

    public List<PhraseMatch> findPhraseMatches(String text) {
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Snapshot current = snapshot.get();
        List<String> words = TextNormalizer.words(normalized);

        List<PhraseMatch> matches = exactMatches(current, normalized);
        if (matches.isEmpty()) {
            matches = partialMatches(current, words);
        }
        if (matches.isEmpty()) {
            matches = fuzzyMatches(current, words);
        }
        return matches;
    }

    /**
     * Merges song ids into a phrase, creating it when absent. Returns the normalized phrase.
     */
    public synchronized String addPhrase(String phrase, Collection<String> songIds) {
        String normalized = TextNormalizer.normalize(phrase);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("phrase must contain at least one word");
        }
        Snapshot current = snapshot.get();
        Map<String, Set<String>> phrases = new LinkedHashMap<>(current.phraseToSongs);
        Set<String> merged = new LinkedHashSet<>(phrases.getOrDefault(normalized, Set.of()));
        merged.addAll(cleanIds(songIds));
        phrases.put(normalized, merged);

        Map<String, List<String>> wordIndex = new HashMap<>(current.wordToPhrases);
        if (!current.phraseToSongs.containsKey(normalized)) {
            for (String word : indexedWords(normalized)) {
                List<String> indexed = new ArrayList<>(wordIndex.getOrDefault(word, List.of()));
                indexed.add(normalized);
                wordIndex.put(word, Collections.unmodifiableList(indexed));
            }
        }
        snapshot.set(new Snapshot(freeze(phrases), Collections.unmodifiableMap(wordIndex)));
        return normalized;
    }

    public List<String> phrasesForWord(String word) {
        String normalized = TextNormalizer.normalize(word);
        return snapshot.get().wordToPhrases.getOrDefault(normalized, List.of());
    }

    public Set<String> songIdsFor(String phrase) {
        return snapshot.get().phraseToSongs.getOrDefault(TextNormalizer.normalize(phrase), Set.of());
    }

    public LexiconStats stats() {
        Snapshot current = snapshot.get();
        int totalPhrases = current.phraseToSongs.size();
        int totalMappings = 0;
        for (Set<String> songIds : current.phraseToSongs.values()) {
            totalMappings += songIds.size();
        }
        double average = totalPhrases == 0 ? 0.0 : (double) totalMappings / totalPhrases;
        return new LexiconStats(totalPhrases, totalMappings, average, current.wordToPhrases.size());
    }

    private static List<PhraseMatch> exactMatches(Snapshot current, String normalized) {
        List<PhraseMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : current.phraseToSongs.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                matches.add(new PhraseMatch(entry.getKey(), List.copyOf(entry.getValue()), 1.0, PhraseMatchType.EXACT));
            }
        }
        return matches;
    }

    private static List<PhraseMatch> partialMatches(Snapshot current, List<String> words) {
        List<String> queryWords = words.stream().filter(word -> word.length() >= MIN_INDEXED_WORD_LENGTH).toList();
        if (queryWords.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Set<String>> matchedPhrases = new HashMap<>();
        for (String word : queryWords) {
            List<String> phrases = current.wordToPhrases.getOrDefault(word, List.of());
            Set<String> songsForWord = new LinkedHashSet<>();
            for (String phrase : phrases) {
                for (String songId : current.phraseToSongs.getOrDefault(phrase, Set.of())) {
                    songsForWord.add(songId);
                    matchedPhrases.computeIfAbsent(songId, key -> new LinkedHashSet<>()).add(phrase);
                }
            }
            for (String songId : songsForWord) {
                counts.merge(songId, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        List<PhraseMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ranked) {
            if (matches.size() >= PARTIAL_LIMIT) {
                break;
            }
            double confidence = Math.min((double) entry.getValue() / queryWords.size(), PARTIAL_MAX_CONFIDENCE);
            if (confidence <= PARTIAL_MIN_CONFIDENCE) {
                continue;
            }
            String phrase = String.join(", ", matchedPhrases.get(entry.getKey()));
            matches.add(new PhraseMatch(phrase, List.of(entry.getKey()), confidence, PhraseMatchType.PARTIAL));
        }
        return matches;
    }

    private static List<PhraseMatch> fuzzyMatches(Snapshot current, List<String> words) {
        List<PhraseMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : current.phraseToSongs.entrySet()) {
            List<String> phraseWords = TextNormalizer.words(entry.getKey());
            int matched = 0;
            for (String phraseWord : phraseWords) {
                for (String word : words) {
                    if (WordSimilarity.isSimilar(phraseWord, word)) {
                        matched++;
                        break;
                    }
                }
            }
            double overlap = (double) matched / phraseWords.size();
            if (overlap >= FUZZY_MIN_OVERLAP && matched >= FUZZY_MIN_MATCHED_WORDS) {
                matches.add(new PhraseMatch(
                    entry.getKey(),
                    List.copyOf(entry.getValue()),
                    overlap * FUZZY_WEIGHT,
                    PhraseMatchType.FUZZY
                ));
            }
        }
        matches.sort(Comparator.comparingDouble(PhraseMatch::confidence).reversed());
        return matches.size() > FUZZY_LIMIT ? List.copyOf(matches.subList(0, FUZZY_LIMIT)) : matches;
    }

    private static Set<String> indexedWords(String phrase) {
        Set<String> words = new LinkedHashSet<>();
        for (String word : TextNormalizer.words(phrase)) {
            if (word.length() >= MIN_INDEXED_WORD_LENGTH) {
                words.add(word);
            }
        }
        return words;
    }

    private static List<String> cleanIds(Collection<String> songIds) {
        if (songIds == null) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (String songId : songIds) {
            if (songId != null && !songId.isBlank()) {
                ids.add(songId.trim());
            }
        }
        return ids;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> phrases) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : phrases.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(frozen);
    }

    private record Snapshot(Map<String, Set<String>> phraseToSongs, Map<String, List<String>> wordToPhrases) {
        static Snapshot build(Map<String, Set<String>> phrases) {
            Map<String, List<String>> wordIndex = new HashMap<>();
            for (String phrase : phrases.keySet()) {
                for (String word : indexedWords(phrase)) {
                    wordIndex.computeIfAbsent(word, key -> new ArrayList<>()).add(phrase);
                }
            }
            Map<String, List<String>> frozenIndex = new HashMap<>();
            wordIndex.forEach((word, list) -> frozenIndex.put(word, List.copyOf(list)));
            return new Snapshot(freeze(phrases), Collections.unmodifiableMap(frozenIndex));
        }
    }
}
