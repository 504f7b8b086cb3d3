package com.tunechat.match.match;

import com.tunechat.match.catalog.Song;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Picks alternates that differ from the primary, and from each other, by artist and decade.
 */
@Component
public class DiversitySelector {

    public List<MatchCandidate> select(
        MatchCandidate primary,
        List<MatchCandidate> ranked,
        boolean relaxed,
        int maxAlternates
    ) {
        if (primary == null || ranked == null || maxAlternates <= 0) {
            return List.of();
        }
        List<MatchCandidate> alternates = new ArrayList<>(maxAlternates);
        for (MatchCandidate candidate : ranked) {
            if (alternates.size() >= maxAlternates) {
                break;
            }
            if (accept(candidate, primary, alternates, relaxed)) {
                alternates.add(candidate);
            }
        }
        return alternates;
    }

    /**
     * True when the songs cover at least two distinct decades.
     */
    public static boolean spansMultipleEras(List<Song> songs) {
        Set<Integer> decades = new HashSet<>();
        for (Song song : songs) {
            if (song.decade() != null) {
                decades.add(song.decade());
            }
        }
        return decades.size() >= 2;
    }

    private static boolean accept(
        MatchCandidate candidate,
        MatchCandidate primary,
        List<MatchCandidate> accepted,
        boolean relaxed
    ) {
        Song song = candidate.song();
        if (song.id().equalsIgnoreCase(primary.song().id())) {
            return false;
        }
        if (!relaxed && (song.sameArtistAs(primary.song()) || sameDecade(song, primary.song()))) {
            return false;
        }
        for (MatchCandidate existing : accepted) {
            if (song.id().equalsIgnoreCase(existing.song().id()) || song.sameArtistAs(existing.song())) {
                return false;
            }
            if (!relaxed && sameDecade(song, existing.song())) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameDecade(Song a, Song b) {
        return a.decade() != null && b.decade() != null && Objects.equals(a.decade(), b.decade());
    }
}
