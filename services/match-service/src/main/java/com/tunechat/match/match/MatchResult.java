package com.tunechat.match.match;

import java.util.List;

public record MatchResult(
    MatchCandidate primary,
    List<MatchCandidate> alternates,
    double confidence,
    String strategy,
    MatchExplanation explanation
) {
    public MatchResult {
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
    }
}
