package com.tunechat.match.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class LexiconStatsResponse {
    @JsonProperty("total_phrases")
    private int totalPhrases;

    @JsonProperty("total_song_mappings")
    private int totalSongMappings;

    @JsonProperty("average_songs_per_phrase")
    private double averageSongsPerPhrase;

    @JsonProperty("indexed_words")
    private int indexedWords;

    public int getTotalPhrases() {
        return totalPhrases;
    }

    public void setTotalPhrases(int totalPhrases) {
        this.totalPhrases = totalPhrases;
    }

    public int getTotalSongMappings() {
        return totalSongMappings;
    }

    public void setTotalSongMappings(int totalSongMappings) {
        this.totalSongMappings = totalSongMappings;
    }

    public double getAverageSongsPerPhrase() {
        return averageSongsPerPhrase;
    }

    public void setAverageSongsPerPhrase(double averageSongsPerPhrase) {
        this.averageSongsPerPhrase = averageSongsPerPhrase;
    }

    public int getIndexedWords() {
        return indexedWords;
    }

    public void setIndexedWords(int indexedWords) {
        this.indexedWords = indexedWords;
    }
}
