package com.tunechat.match.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the song catalog. Implementations throw {@link CatalogUnavailableException}
 * when the backing store cannot be reached.
 */
public interface CatalogStore {
    Optional<Song> findById(String songId);

    /**
     * Non-placeholder songs for the given ids, in the order the ids were given. Unknown ids are
     * skipped.
     */
    List<Song> findByIds(Collection<String> songIds);

    /**
     * Non-placeholder songs ordered by popularity descending.
     */
    default List<Song> findTopByPopularity(int limit) {
        return findTopByPopularity(limit, Set.of());
    }

    /**
     * Like {@link #findTopByPopularity(int)}, skipping songs that carry any of the given tags
     * (compared case-insensitively). The limit applies after the exclusion.
     */
    List<Song> findTopByPopularity(int limit, Set<String> excludedTags);

    /**
     * Number of non-placeholder songs carrying a metadata embedding.
     */
    long countEligible();

    /**
     * Approximate nearest neighbors by cosine distance, ascending, at most {@code k}.
     */
    List<VectorNeighbor> nearestNeighbors(VectorSpace space, float[] queryVector, int k);
}
