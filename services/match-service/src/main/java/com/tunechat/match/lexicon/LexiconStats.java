package com.tunechat.match.lexicon;

public record LexiconStats(int totalPhrases, int totalSongMappings, double averageSongsPerPhrase, int indexedWords) {
}
