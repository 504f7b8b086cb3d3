package com.tunechat.match.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class LexiconPhraseResponse {
    private String phrase;

    @JsonProperty("song_ids")
    private List<String> songIds;

    public LexiconPhraseResponse() {
    }

    public LexiconPhraseResponse(String phrase, List<String> songIds) {
        this.phrase = phrase;
        this.songIds = songIds;
    }

    public String getPhrase() {
        return phrase;
    }

    public void setPhrase(String phrase) {
        this.phrase = phrase;
    }

    public List<String> getSongIds() {
        return songIds;
    }

    public void setSongIds(List<String> songIds) {
        this.songIds = songIds;
    }
}
