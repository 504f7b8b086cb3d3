package com.tunechat.match.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(MatchResilienceProperties.class)
public class MatchResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker annBreaker;

    public MatchResilienceRegistry(MatchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embed",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
        this.annBreaker = new CircuitBreaker(
            "ann",
            properties.getAnnFailureThreshold(),
            properties.getAnnOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getAnnBreaker() {
        return annBreaker;
    }
}
