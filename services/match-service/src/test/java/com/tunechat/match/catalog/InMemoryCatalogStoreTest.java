package com.tunechat.match.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryCatalogStoreTest {

    private final InMemoryCatalogStore store = new InMemoryCatalogStore(
        List.of(
            song("a", 70, new float[] {1f, 0f}, false),
            song("b", 90, new float[] {0f, 1f}, false),
            song("c", 70, null, false),
            song("p", 100, new float[] {1f, 0f}, true)
        ),
        Map.of("b", new float[] {1f, 0f})
    );

    @Test
    void findByIdsSkipsPlaceholdersUnknownsAndDuplicates() {
        List<Song> songs = store.findByIds(Arrays.asList("c", "p", "zzz", null, "a", "c"));

        assertThat(songs).extracting(Song::id).containsExactly("c", "a");
        assertThat(store.findById("p")).isPresent();
    }

    @Test
    void popularityOrderBreaksTiesById() {
        assertThat(store.findTopByPopularity(3)).extracting(Song::id).containsExactly("b", "a", "c");
        assertThat(store.findTopByPopularity(0)).isEmpty();
    }

    @Test
    void idsMatchRegardlessOfCase() {
        InMemoryCatalogStore mixedCase = new InMemoryCatalogStore(
            List.of(song("Song-A", 50, new float[] {1f, 0f}, false)),
            Map.of("SONG-A", new float[] {0f, 1f})
        );

        assertThat(mixedCase.findByIds(List.of("song-a", "SONG-A"))).extracting(Song::id).containsExactly("Song-A");
        assertThat(mixedCase.findById(" song-a ")).isPresent();
        assertThat(mixedCase.nearestNeighbors(VectorSpace.ABOUTNESS, new float[] {0f, 1f}, 1))
            .extracting(VectorNeighbor::songId)
            .containsExactly("Song-A");
    }

    @Test
    void excludedTagsAreDroppedBeforeTheLimit() {
        InMemoryCatalogStore tagged = new InMemoryCatalogStore(List.of(
            new Song("x1", "t", "a", 2000, 99, Set.of("Explicit"), Set.of(), null, false, null),
            new Song("x2", "t", "a", 2000, 98, Set.of("adult", "pop"), Set.of(), null, false, null),
            new Song("c1", "t", "a", 2000, 10, Set.of("pop"), Set.of(), null, false, null)
        ));

        assertThat(tagged.findTopByPopularity(1, Set.of("explicit", "ADULT"))).extracting(Song::id).containsExactly("c1");
        assertThat(tagged.findTopByPopularity(1)).extracting(Song::id).containsExactly("x1");
    }

    @Test
    void onlyEmbeddedNonPlaceholderSongsAreEligible() {
        assertThat(store.countEligible()).isEqualTo(2L);
    }

    @Test
    void neighborsAreSearchedPerVectorSpace() {
        float[] query = {1f, 0f};

        assertThat(store.nearestNeighbors(VectorSpace.META, query, 5))
            .extracting(VectorNeighbor::songId)
            .containsExactly("a", "b");
        assertThat(store.nearestNeighbors(VectorSpace.ABOUTNESS, query, 5))
            .extracting(VectorNeighbor::songId)
            .containsExactly("b");
        assertThat(store.nearestNeighbors(VectorSpace.META, query, 1)).hasSize(1);
    }

    private static Song song(String id, int popularity, float[] embedding, boolean placeholder) {
        return new Song(id, "title-" + id, "artist-" + id, 1990, popularity, Set.of(), Set.of(), embedding, placeholder, null);
    }
}
