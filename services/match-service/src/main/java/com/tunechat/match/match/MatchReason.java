package com.tunechat.match.match;

public record MatchReason(
    String matchedPhrase,
    String matchType,
    String mood,
    Double similarity,
    Double metaDistance,
    Double aboutnessDistance
) {
    public static MatchReason phrase(String matchedPhrase, String matchType) {
        return new MatchReason(matchedPhrase, matchType, null, null, null, null);
    }

    public static MatchReason semantic(String mood, double similarity, Double metaDistance, Double aboutnessDistance) {
        return new MatchReason(null, null, mood, similarity, metaDistance, aboutnessDistance);
    }

    public static MatchReason fallback() {
        return new MatchReason(null, null, MoodDetector.NEUTRAL, null, null, null);
    }
}
