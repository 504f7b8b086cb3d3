package com.tunechat.match.lexicon;

import java.util.List;

public record PhraseMatch(String phrase, List<String> songIds, double confidence, PhraseMatchType matchType) {
    public PhraseMatch {
        songIds = songIds == null ? List.of() : List.copyOf(songIds);
    }
}
