package com.tunechat.match.embed;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getHttp().getTimeoutMs());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }

    @Bean
    public ToyEmbedder toyEmbedder(EmbeddingProperties properties) {
        return new ToyEmbedder(properties);
    }

    @Bean
    public EmbeddingCacheService embeddingCacheService(EmbeddingProperties properties, MeterRegistry meterRegistry) {
        log.info(
            "embedding provider mode={} model={} dimension={} cache={}",
            properties.getMode(),
            properties.getModel(),
            properties.getDimension(),
            properties.getCache().isEnabled()
        );
        return new EmbeddingCacheService(properties, meterRegistry);
    }
}
