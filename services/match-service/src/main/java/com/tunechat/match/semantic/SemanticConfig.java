package com.tunechat.match.semantic;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SemanticSearchProperties.class)
public class SemanticConfig {
}
