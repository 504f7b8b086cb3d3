package com.tunechat.match.semantic;

import com.tunechat.match.catalog.CatalogStore;
import com.tunechat.match.catalog.Song;
import com.tunechat.match.catalog.VectorNeighbor;
import com.tunechat.match.catalog.VectorSpace;
import com.tunechat.match.embed.EmbeddingProperties;
import com.tunechat.match.embed.EmbeddingProvider;
import com.tunechat.match.embed.EmbeddingUnavailableException;
import com.tunechat.match.resilience.CircuitBreaker;
import com.tunechat.match.resilience.MatchResilienceRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class VectorSemanticSearcher implements SemanticSearcher {
    private static final Logger log = LoggerFactory.getLogger(VectorSemanticSearcher.class);

    private final CatalogStore catalogStore;
    private final EmbeddingProvider embeddingProvider;
    private final SemanticSearchProperties properties;
    private final EmbeddingProperties embeddingProperties;
    private final MatchResilienceRegistry resilienceRegistry;
    private final AboutnessReranker aboutnessReranker;

    public VectorSemanticSearcher(
        CatalogStore catalogStore,
        EmbeddingProvider embeddingProvider,
        SemanticSearchProperties properties,
        EmbeddingProperties embeddingProperties,
        MatchResilienceRegistry resilienceRegistry,
        AboutnessReranker aboutnessReranker
    ) {
        this.catalogStore = catalogStore;
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
        this.embeddingProperties = embeddingProperties;
        this.resilienceRegistry = resilienceRegistry;
        this.aboutnessReranker = aboutnessReranker;
    }

    @Override
    public List<SemanticHit> search(String normalizedText, int k) {
        if (normalizedText == null || normalizedText.isBlank() || k <= 0) {
            return List.of();
        }

        float[] queryVector;
        try {
            queryVector = VectorCodec.fromProvider(
                embeddingProvider.embed(normalizedText),
                embeddingProperties.getDimension()
            );
        } catch (EmbeddingUnavailableException | InvalidVectorException e) {
            log.warn("semantic search skipped, embedding failed: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("semantic search skipped, embedding provider error", e);
            return List.of();
        }

        CircuitBreaker breaker = resilienceRegistry.getAnnBreaker();
        if (!breaker.allowRequest()) {
            log.warn("semantic search skipped, ann circuit open");
            return List.of();
        }

        try {
            long eligible = catalogStore.countEligible();
            if (eligible == 0) {
                log.warn("semantic search skipped, no embedded songs in catalog");
                breaker.recordSuccess();
                return List.of();
            }

            if (properties.getAboutness().isEnabled()) {
                List<SemanticHit> blended = searchAboutness(queryVector, k);
                if (!blended.isEmpty()) {
                    breaker.recordSuccess();
                    return blended;
                }
            }

            int limit = k * Math.max(1, properties.getOverfetchFactor());
            List<VectorNeighbor> neighbors = catalogStore.nearestNeighbors(VectorSpace.META, queryVector, limit);
            List<SemanticHit> hits = new ArrayList<>(neighbors.size());
            for (VectorNeighbor neighbor : neighbors) {
                if (neighbor.similarity() >= properties.getSimilarityThreshold()) {
                    hits.add(SemanticHit.of(neighbor.songId(), neighbor.distance()));
                }
            }
            if (properties.isPreciseRerank() && !hits.isEmpty()) {
                hits = preciseRerank(hits, queryVector);
            }
            breaker.recordSuccess();
            log.debug("semantic search eligible={} fetched={} kept={}", eligible, neighbors.size(), hits.size());
            return hits;
        } catch (RuntimeException e) {
            if (breaker.recordFailure()) {
                log.warn("ann circuit opened after repeated failures");
            }
            log.warn("semantic search failed: {}", e.getMessage());
            return List.of();
        }
    }

    private List<SemanticHit> searchAboutness(float[] queryVector, int k) {
        try {
            return aboutnessReranker.rerank(queryVector, k);
        } catch (RuntimeException e) {
            log.warn("aboutness rerank failed, falling back to metadata search: {}", e.getMessage());
            return List.of();
        }
    }

    private List<SemanticHit> preciseRerank(List<SemanticHit> hits, float[] queryVector) {
        int window = Math.min(Math.max(0, properties.getRerankWindow()), hits.size());
        if (window == 0) {
            return hits;
        }
        List<SemanticHit> head = hits.subList(0, window);
        Map<String, Song> songs = new HashMap<>();
        for (Song song : catalogStore.findByIds(head.stream().map(SemanticHit::songId).toList())) {
            songs.put(idKey(song.id()), song);
        }

        List<SemanticHit> reranked = new ArrayList<>(hits.size());
        for (SemanticHit hit : head) {
            Song song = songs.get(idKey(hit.songId()));
            if (song == null || song.embedding() == null || song.embedding().length != queryVector.length) {
                reranked.add(hit);
                continue;
            }
            double distance = VectorMath.cosineDistance(queryVector, song.embedding());
            if (1.0 - distance >= properties.getSimilarityThreshold()) {
                reranked.add(SemanticHit.of(hit.songId(), distance));
            }
        }
        reranked.sort(Comparator.comparingDouble(SemanticHit::similarity).reversed());
        reranked.addAll(hits.subList(window, hits.size()));
        return reranked;
    }

    private static String idKey(String songId) {
        return songId == null ? "" : songId.toLowerCase(Locale.ROOT);
    }
}
