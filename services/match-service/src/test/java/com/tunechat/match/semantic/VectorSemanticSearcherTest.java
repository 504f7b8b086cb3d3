package com.tunechat.match.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tunechat.match.catalog.CatalogStore;
import com.tunechat.match.catalog.CatalogUnavailableException;
import com.tunechat.match.catalog.InMemoryCatalogStore;
import com.tunechat.match.catalog.Song;
import com.tunechat.match.catalog.VectorNeighbor;
import com.tunechat.match.catalog.VectorSpace;
import com.tunechat.match.embed.EmbeddingProperties;
import com.tunechat.match.embed.EmbeddingProvider;
import com.tunechat.match.embed.EmbeddingUnavailableException;
import com.tunechat.match.resilience.MatchResilienceProperties;
import com.tunechat.match.resilience.MatchResilienceRegistry;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VectorSemanticSearcherTest {

    @Mock
    private CatalogStore catalogStore;

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private AboutnessReranker aboutnessReranker;

    private SemanticSearchProperties properties;
    private EmbeddingProperties embeddingProperties;
    private MatchResilienceProperties resilienceProperties;

    @BeforeEach
    void setUp() {
        properties = new SemanticSearchProperties();
        embeddingProperties = new EmbeddingProperties();
        embeddingProperties.setDimension(3);
        resilienceProperties = new MatchResilienceProperties();
    }

    @Test
    void returnsNeighborsBySimilarityWithoutPlaceholders() {
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        InMemoryCatalogStore store = inMemoryCatalog();

        List<SemanticHit> hits = searcher(store).search("sunny day", 2);

        assertThat(hits).extracting(SemanticHit::songId).containsExactly("s1", "s2", "s3");
        assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
        assertThat(hits.get(1).similarity()).isCloseTo(0.8, within(1e-6));
        assertThat(hits).noneMatch(SemanticHit::isBlended);
    }

    @Test
    void similarityThresholdDropsWeakHits() {
        properties.setSimilarityThreshold(0.5);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));

        List<SemanticHit> hits = searcher(inMemoryCatalog()).search("sunny day", 5);

        assertThat(hits).extracting(SemanticHit::songId).containsExactly("s1", "s2");
    }

    @Test
    void embeddingFailureYieldsEmptyResult() {
        when(embeddingProvider.embed("sunny day")).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        assertThat(searcher(catalogStore).search("sunny day", 5)).isEmpty();
        verifyNoInteractions(catalogStore);
    }

    @Test
    void malformedVectorsYieldEmptyResult() {
        when(embeddingProvider.embed("wrong size")).thenReturn(List.of(1.0, 0.0));
        when(embeddingProvider.embed("not finite")).thenReturn(List.of(Double.NaN, 0.0, 0.0));
        when(embeddingProvider.embed("empty")).thenReturn(List.of());

        VectorSemanticSearcher searcher = searcher(catalogStore);

        assertThat(searcher.search("wrong size", 5)).isEmpty();
        assertThat(searcher.search("not finite", 5)).isEmpty();
        assertThat(searcher.search("empty", 5)).isEmpty();
        verifyNoInteractions(catalogStore);
    }

    @Test
    void blankTextIsNotEmbedded() {
        assertThat(searcher(catalogStore).search("  ", 5)).isEmpty();
        verifyNoInteractions(embeddingProvider);
    }

    @Test
    void catalogWithoutEmbeddedSongsShortCircuits() {
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(0L);

        assertThat(searcher(catalogStore).search("sunny day", 5)).isEmpty();
        verify(catalogStore, never()).nearestNeighbors(any(), any(), anyInt());
    }

    @Test
    void repeatedCatalogFailuresOpenTheCircuit() {
        resilienceProperties.setAnnFailureThreshold(2);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(5L);
        when(catalogStore.nearestNeighbors(eq(VectorSpace.META), any(), anyInt()))
            .thenThrow(new CatalogUnavailableException("catalog_ann_failed"));

        VectorSemanticSearcher searcher = searcher(catalogStore);

        assertThat(searcher.search("sunny day", 5)).isEmpty();
        assertThat(searcher.search("sunny day", 5)).isEmpty();
        assertThat(searcher.search("sunny day", 5)).isEmpty();
        verify(catalogStore, times(2)).countEligible();
    }

    @Test
    void overFetchesByConfiguredFactor() {
        properties.setOverfetchFactor(3);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(5L);
        when(catalogStore.nearestNeighbors(eq(VectorSpace.META), any(), eq(12))).thenReturn(List.of());

        assertThat(searcher(catalogStore).search("sunny day", 4)).isEmpty();
        verify(catalogStore).nearestNeighbors(eq(VectorSpace.META), any(), eq(12));
    }

    @Test
    void preciseRerankCorrectsApproximateOrder() {
        properties.setPreciseRerank(true);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(2L);
        when(catalogStore.nearestNeighbors(eq(VectorSpace.META), any(), anyInt())).thenReturn(List.of(
            new VectorNeighbor("s2", 0.1),
            new VectorNeighbor("s1", 0.3)
        ));
        when(catalogStore.findByIds(anyCollection())).thenReturn(List.of(
            song("s1", new float[] {1f, 0f, 0f}, false),
            song("s2", new float[] {0f, 1f, 0f}, false)
        ));

        List<SemanticHit> hits = searcher(catalogStore).search("sunny day", 5);

        assertThat(hits).extracting(SemanticHit::songId).containsExactly("s1", "s2");
        assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-6));
        assertThat(hits.get(1).distance()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void aboutnessPathIsUsedWhenEnabled() {
        properties.getAboutness().setEnabled(true);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(2L);
        List<SemanticHit> blended = List.of(SemanticHit.blended("s2", 0.3, 0.1, 0.8));
        when(aboutnessReranker.rerank(any(), eq(5))).thenReturn(blended);

        assertThat(searcher(catalogStore).search("sunny day", 5)).isEqualTo(blended);
        verify(catalogStore, never()).nearestNeighbors(any(), any(), anyInt());
    }

    @Test
    void aboutnessFailureFallsBackToMetadataSearch() {
        properties.getAboutness().setEnabled(true);
        when(embeddingProvider.embed("sunny day")).thenReturn(List.of(1.0, 0.0, 0.0));
        when(catalogStore.countEligible()).thenReturn(2L);
        when(aboutnessReranker.rerank(any(), anyInt())).thenThrow(new CatalogUnavailableException("catalog_ann_failed"));
        when(catalogStore.nearestNeighbors(eq(VectorSpace.META), any(), anyInt()))
            .thenReturn(List.of(new VectorNeighbor("s1", 0.2)));

        List<SemanticHit> hits = searcher(catalogStore).search("sunny day", 5);

        assertThat(hits).extracting(SemanticHit::songId).containsExactly("s1");
        verify(embeddingProvider, times(1)).embed("sunny day");
    }

    private VectorSemanticSearcher searcher(CatalogStore store) {
        AboutnessReranker reranker = store == catalogStore ? aboutnessReranker : new AboutnessReranker(store, properties);
        return new VectorSemanticSearcher(
            store,
            embeddingProvider,
            properties,
            embeddingProperties,
            new MatchResilienceRegistry(resilienceProperties),
            reranker
        );
    }

    private static InMemoryCatalogStore inMemoryCatalog() {
        return new InMemoryCatalogStore(List.of(
            song("s1", new float[] {1f, 0f, 0f}, false),
            song("s2", new float[] {0.8f, 0.6f, 0f}, false),
            song("s3", new float[] {0f, 1f, 0f}, false),
            song("s4", new float[] {1f, 0f, 0f}, true),
            song("s5", null, false)
        ));
    }

    private static Song song(String id, float[] embedding, boolean placeholder) {
        return new Song(id, "title-" + id, "artist-" + id, 2000, 50, Set.of(), Set.of(), embedding, placeholder, null);
    }
}
