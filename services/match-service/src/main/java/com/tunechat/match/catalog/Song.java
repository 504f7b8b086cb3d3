package com.tunechat.match.catalog;

import java.util.Locale;
import java.util.Set;

public record Song(
    String id,
    String title,
    String artist,
    Integer year,
    int popularity,
    Set<String> tags,
    Set<String> phrases,
    float[] embedding,
    boolean placeholder,
    String canonicalId
) {
    public Song {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        phrases = phrases == null ? Set.of() : Set.copyOf(phrases);
        popularity = Math.max(0, Math.min(100, popularity));
    }

    public Integer decade() {
        return year == null ? null : year / 10 * 10;
    }

    public boolean hasAnyTag(Set<String> lowerCaseTags) {
        for (String tag : tags) {
            if (tag != null && lowerCaseTags.contains(tag.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    public boolean sameArtistAs(Song other) {
        if (artist == null || other.artist == null) {
            return false;
        }
        return artist.trim().equalsIgnoreCase(other.artist.trim());
    }

    public String displayName() {
        return artist + " - " + title;
    }
}
