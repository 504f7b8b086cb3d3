package com.tunechat.match.semantic;

import java.util.List;

public interface SemanticSearcher {
    /**
     * Candidates for already-normalized text, best first. Never throws; any failure yields an
     * empty list.
     */
    List<SemanticHit> search(String normalizedText, int k);
}
