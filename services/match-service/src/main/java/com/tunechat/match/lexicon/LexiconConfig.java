package com.tunechat.match.lexicon;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties(LexiconProperties.class)
public class LexiconConfig {
    @Bean
    public PhraseLexicon phraseLexicon(
        LexiconProperties properties,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper
    ) {
        return new PhraseLexiconLoader(resourceLoader, objectMapper).load(properties.getResource(), properties.isStrict());
    }
}
