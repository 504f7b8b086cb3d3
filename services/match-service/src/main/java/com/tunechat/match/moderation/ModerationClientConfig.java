package com.tunechat.match.moderation;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(ModerationProperties.class)
public class ModerationClientConfig {

    @Bean
    public RestTemplate moderationRestTemplate(RestTemplateBuilder builder, ModerationProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean
    public ModerationClient moderationClient(
        ModerationProperties properties,
        @Qualifier("moderationRestTemplate") RestTemplate restTemplate
    ) {
        if (properties.getMode() == ModerationMode.HTTP) {
            return new HttpModerationClient(restTemplate, properties.getBaseUrl());
        }
        return new PassThroughModerationClient();
    }
}
