package com.tunechat.match.semantic;

import com.tunechat.match.catalog.CatalogStore;
import com.tunechat.match.catalog.Song;
import com.tunechat.match.catalog.VectorNeighbor;
import com.tunechat.match.catalog.VectorSpace;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Unions the metadata and aboutness neighbor sets for one query vector and ranks the union by a
 * weighted blend of both similarities.
 */
@Component
public class AboutnessReranker {
    private static final Logger log = LoggerFactory.getLogger(AboutnessReranker.class);

    private final CatalogStore catalogStore;
    private final SemanticSearchProperties properties;

    public AboutnessReranker(CatalogStore catalogStore, SemanticSearchProperties properties) {
        this.catalogStore = catalogStore;
        this.properties = properties;
    }

    public List<SemanticHit> rerank(float[] queryVector, int k) {
        SemanticSearchProperties.Aboutness config = properties.getAboutness();
        int topN = Math.max(1, config.getTopN());

        List<VectorNeighbor> metaLeg = null;
        List<VectorNeighbor> aboutnessLeg = null;
        RuntimeException metaFailure = null;
        try {
            metaLeg = catalogStore.nearestNeighbors(VectorSpace.META, queryVector, topN);
        } catch (RuntimeException e) {
            metaFailure = e;
            log.warn("aboutness rerank meta leg failed, using aboutness only: {}", e.getMessage());
        }
        try {
            aboutnessLeg = catalogStore.nearestNeighbors(VectorSpace.ABOUTNESS, queryVector, topN);
        } catch (RuntimeException e) {
            if (metaFailure != null) {
                e.addSuppressed(metaFailure);
                throw e;
            }
            log.warn("aboutness rerank aboutness leg failed, using meta only: {}", e.getMessage());
        }

        Map<String, Double[]> union = new LinkedHashMap<>();
        if (metaLeg != null) {
            for (VectorNeighbor neighbor : metaLeg) {
                union.computeIfAbsent(neighbor.songId(), id -> new Double[2])[0] = neighbor.distance();
            }
        }
        if (aboutnessLeg != null) {
            for (VectorNeighbor neighbor : aboutnessLeg) {
                union.computeIfAbsent(neighbor.songId(), id -> new Double[2])[1] = neighbor.distance();
            }
        }
        if (union.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> popularity = new HashMap<>();
        for (Song song : catalogStore.findByIds(union.keySet())) {
            popularity.put(song.id(), song.popularity());
        }

        List<SemanticHit> hits = new ArrayList<>(union.size());
        for (Map.Entry<String, Double[]> entry : union.entrySet()) {
            Double metaDistance = entry.getValue()[0];
            Double aboutnessDistance = entry.getValue()[1];
            double simMeta = metaDistance == null ? 0.0 : 1.0 - metaDistance;
            double simAbout = aboutnessDistance == null ? 0.0 : 1.0 - aboutnessDistance;
            double blended = config.getMetaWeight() * simMeta + config.getAboutnessWeight() * simAbout;
            hits.add(SemanticHit.blended(entry.getKey(), metaDistance, aboutnessDistance, blended));
        }
        hits.sort(
            Comparator.comparingDouble(SemanticHit::score).reversed()
                .thenComparing(hit -> popularity.getOrDefault(hit.songId(), 0), Comparator.reverseOrder())
                .thenComparing(SemanticHit::songId)
        );

        int limit = Math.max(1, k) * 2;
        log.debug(
            "aboutness rerank meta={} aboutness={} union={} returned={}",
            metaLeg == null ? -1 : metaLeg.size(),
            aboutnessLeg == null ? -1 : aboutnessLeg.size(),
            hits.size(),
            Math.min(limit, hits.size())
        );
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }
}
