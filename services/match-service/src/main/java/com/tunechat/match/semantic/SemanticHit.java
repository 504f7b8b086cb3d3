package com.tunechat.match.semantic;

/**
 * One semantic candidate. The per-space distances and the blended score are only set on the
 * aboutness path.
 */
public record SemanticHit(
    String songId,
    double similarity,
    double distance,
    Double metaDistance,
    Double aboutnessDistance,
    Double blendedScore
) {
    public static SemanticHit of(String songId, double distance) {
        return new SemanticHit(songId, 1.0 - distance, distance, null, null, null);
    }

    public static SemanticHit blended(String songId, Double metaDistance, Double aboutnessDistance, double blendedScore) {
        return new SemanticHit(songId, blendedScore, 1.0 - blendedScore, metaDistance, aboutnessDistance, blendedScore);
    }

    public double score() {
        return blendedScore != null ? blendedScore : similarity;
    }

    public boolean isBlended() {
        return blendedScore != null;
    }
}
