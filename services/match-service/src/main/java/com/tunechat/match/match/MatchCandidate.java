package com.tunechat.match.match;

import com.tunechat.match.catalog.Song;

public record MatchCandidate(Song song, double rawScore, MatchStrategy strategy, MatchReason reason) {
}
