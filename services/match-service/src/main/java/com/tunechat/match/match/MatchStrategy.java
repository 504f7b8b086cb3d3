package com.tunechat.match.match;

public enum MatchStrategy {
    EXACT("exact", "phrase"),
    PHRASE("phrase", "phrase"),
    EMBEDDING("embedding", "embedding"),
    ABOUTNESS_RERANK("aboutness-rerank", "aboutness-rerank"),
    POPULARITY_FALLBACK("popularity-fallback", "popularity-fallback");

    private final String tag;
    private final String stage;

    MatchStrategy(String tag, String stage) {
        this.tag = tag;
        this.stage = stage;
    }

    /**
     * Per-candidate tag.
     */
    public String tag() {
        return tag;
    }

    /**
     * Name of the pipeline stage that produced the candidate, used as the result strategy label.
     */
    public String stage() {
        return stage;
    }
}
