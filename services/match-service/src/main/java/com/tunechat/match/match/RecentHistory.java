package com.tunechat.match.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Song ids recently shown to one user, most recent first. Supplied by the caller per request.
 */
public record RecentHistory(List<String> songIds) {
    private static final RecentHistory EMPTY = new RecentHistory(List.of());

    public RecentHistory {
        List<String> cleaned = new ArrayList<>();
        if (songIds != null) {
            for (String songId : songIds) {
                if (songId != null && !songId.isBlank()) {
                    cleaned.add(songId.trim());
                }
            }
        }
        songIds = List.copyOf(cleaned);
    }

    public static RecentHistory empty() {
        return EMPTY;
    }

    public static RecentHistory of(String... songIds) {
        return new RecentHistory(List.of(songIds));
    }

    public boolean isEmpty() {
        return songIds.isEmpty();
    }

    public List<String> mostRecent(int limit) {
        return songIds.size() > limit ? songIds.subList(0, Math.max(0, limit)) : songIds;
    }

    Set<String> idKeys() {
        return songIds.stream().map(id -> id.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }
}
