package com.tunechat.match.embed;

import com.tunechat.match.resilience.CircuitBreaker;
import com.tunechat.match.resilience.MatchResilienceRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingService implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final MatchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        MatchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        return cacheService.getOrLoad(text, this::fetch);
    }

    private List<Double> fetch(String text) {
        if (properties.getMode() != EmbeddingMode.HTTP) {
            return toyEmbedder.embed(text);
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text);
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            if (breaker.recordFailure()) {
                log.warn("embedding circuit opened after repeated failures, last={}", ex.getMessage());
            }
            throw ex;
        }
    }
}
