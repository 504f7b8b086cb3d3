package com.tunechat.match.match;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({MatchOrchestratorProperties.class, CalibrationProperties.class})
public class MatchConfig {
}
