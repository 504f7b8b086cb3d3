package com.tunechat.match.lexicon;

public enum PhraseMatchType {
    EXACT("exact"),
    PARTIAL("partial"),
    FUZZY("fuzzy");

    private final String label;

    PhraseMatchType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
