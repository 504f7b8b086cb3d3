package com.tunechat.match.match;

import com.tunechat.match.moderation.ModerationAnnotation;
import java.util.List;

public record MatchExplanation(
    String matchedPhrase,
    String matchType,
    Double similarity,
    String mood,
    List<String> tags,
    String fallbackReason,
    Double metaDistance,
    Double aboutnessDistance,
    double primaryScore,
    int totalCandidates,
    ModerationAnnotation moderation
) {
    public MatchExplanation {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
