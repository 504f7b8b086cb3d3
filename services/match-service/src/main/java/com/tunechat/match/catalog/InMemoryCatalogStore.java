package com.tunechat.match.catalog;

import com.tunechat.match.semantic.VectorMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog held in memory with an exact cosine scan in place of an ANN index. Used for local
 * runs against the seed resource and as a test double. Ids are matched case-insensitively.
 */
public class InMemoryCatalogStore implements CatalogStore {
    private final Map<String, Song> songsById;
    private final Map<String, float[]> aboutnessVectors;

    public InMemoryCatalogStore(List<Song> songs) {
        this(songs, Map.of());
    }

    public InMemoryCatalogStore(List<Song> songs, Map<String, float[]> aboutnessVectors) {
        Map<String, Song> byId = new LinkedHashMap<>();
        for (Song song : songs) {
            byId.put(key(song.id()), song);
        }
        this.songsById = Collections.unmodifiableMap(byId);
        Map<String, float[]> aboutness = new HashMap<>();
        aboutnessVectors.forEach((songId, vector) -> aboutness.put(key(songId), vector));
        this.aboutnessVectors = Map.copyOf(aboutness);
    }

    @Override
    public Optional<Song> findById(String songId) {
        return songId == null ? Optional.empty() : Optional.ofNullable(songsById.get(key(songId)));
    }

    @Override
    public List<Song> findByIds(Collection<String> songIds) {
        if (songIds == null) {
            return List.of();
        }
        List<Song> found = new ArrayList<>();
        for (String songId : songIds.stream().filter(Objects::nonNull).map(InMemoryCatalogStore::key).distinct().toList()) {
            Song song = songsById.get(songId);
            if (song != null && !song.placeholder()) {
                found.add(song);
            }
        }
        return found;
    }

    @Override
    public List<Song> findTopByPopularity(int limit, Set<String> excludedTags) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> excluded = lowerCase(excludedTags);
        return songsById.values().stream()
            .filter(song -> !song.placeholder())
            .filter(song -> excluded.isEmpty() || !song.hasAnyTag(excluded))
            .sorted(Comparator.comparingInt(Song::popularity).reversed().thenComparing(Song::id))
            .limit(limit)
            .toList();
    }

    @Override
    public long countEligible() {
        return songsById.values().stream()
            .filter(song -> !song.placeholder() && song.embedding() != null)
            .count();
    }

    @Override
    public List<VectorNeighbor> nearestNeighbors(VectorSpace space, float[] queryVector, int k) {
        if (queryVector == null || k <= 0) {
            return List.of();
        }
        List<VectorNeighbor> neighbors = new ArrayList<>();
        for (Song song : songsById.values()) {
            if (song.placeholder()) {
                continue;
            }
            float[] vector = space == VectorSpace.ABOUTNESS ? aboutnessVectors.get(key(song.id())) : song.embedding();
            if (vector == null || vector.length != queryVector.length) {
                continue;
            }
            neighbors.add(new VectorNeighbor(song.id(), VectorMath.cosineDistance(queryVector, vector)));
        }
        neighbors.sort(Comparator.comparingDouble(VectorNeighbor::distance).thenComparing(VectorNeighbor::songId));
        return neighbors.size() > k ? List.copyOf(neighbors.subList(0, k)) : neighbors;
    }

    public int size() {
        return songsById.size();
    }

    private static String key(String songId) {
        return songId == null ? "" : songId.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> lowerCase(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }
        return tags.stream().map(tag -> tag.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }
}
