package com.tunechat.match.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tunechat.match.embed.EmbeddingProperties;
import com.tunechat.match.embed.EmbeddingProvider;
import com.tunechat.match.semantic.VectorCodec;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogConfig {
    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public CatalogStore catalogStore(
        CatalogProperties properties,
        ObjectProvider<JdbcTemplate> jdbcTemplate,
        ObjectProvider<PlatformTransactionManager> transactionManager,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper,
        EmbeddingProvider embeddingProvider,
        EmbeddingProperties embeddingProperties
    ) {
        if (properties.getMode() == CatalogMode.MEMORY) {
            List<SongSeed> seeds = loadSeeds(resourceLoader.getResource(properties.getSeedResource()), objectMapper);
            InMemoryCatalogStore store = buildInMemory(seeds, embeddingProvider, embeddingProperties.getDimension());
            log.info("in-memory catalog loaded songs={} resource={}", store.size(), properties.getSeedResource());
            return store;
        }
        return new JdbcCatalogStore(
            jdbcTemplate.getObject(),
            new TransactionTemplate(transactionManager.getObject()),
            properties.getEfSearch()
        );
    }

    static InMemoryCatalogStore buildInMemory(List<SongSeed> seeds, EmbeddingProvider embeddingProvider, int dimension) {
        List<Song> songs = new ArrayList<>(seeds.size());
        Map<String, float[]> aboutness = new HashMap<>();
        for (SongSeed seed : seeds) {
            if (seed.getId() == null || seed.getId().isBlank()) {
                continue;
            }
            float[] embedding = seed.getEmbedding() == null
                ? embedSeed(seed, embeddingProvider, dimension)
                : VectorCodec.fromProvider(seed.getEmbedding(), dimension);
            songs.add(new Song(
                seed.getId(),
                seed.getTitle(),
                seed.getArtist(),
                seed.getYear(),
                seed.getPopularity(),
                seed.getTags(),
                seed.getPhrases(),
                embedding,
                seed.isPlaceholder(),
                seed.getMbid()
            ));
            if (seed.getAboutnessEmbedding() != null) {
                aboutness.put(seed.getId(), VectorCodec.fromProvider(seed.getAboutnessEmbedding(), dimension));
            }
        }
        return new InMemoryCatalogStore(songs, aboutness);
    }

    private static float[] embedSeed(SongSeed seed, EmbeddingProvider embeddingProvider, int dimension) {
        StringBuilder text = new StringBuilder();
        text.append(seed.getTitle()).append(' ').append(seed.getArtist());
        if (seed.getTags() != null) {
            text.append(' ').append(String.join(" ", seed.getTags()));
        }
        if (seed.getPhrases() != null) {
            text.append(' ').append(String.join(" ", seed.getPhrases()));
        }
        try {
            return VectorCodec.fromProvider(embeddingProvider.embed(text.toString()), dimension);
        } catch (RuntimeException e) {
            log.warn("seed song {} left without embedding: {}", seed.getId(), e.getMessage());
            return null;
        }
    }

    private List<SongSeed> loadSeeds(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("catalog seed resource not found: {}", resource.getDescription());
            return List.of();
        }
        try (InputStream input = resource.getInputStream()) {
            List<SongSeed> seeds = objectMapper.readValue(input, new TypeReference<List<SongSeed>>() {});
            return seeds == null ? List.of() : seeds;
        } catch (IOException e) {
            throw new IllegalStateException("catalog seed resource unreadable: " + resource.getDescription(), e);
        }
    }
}
