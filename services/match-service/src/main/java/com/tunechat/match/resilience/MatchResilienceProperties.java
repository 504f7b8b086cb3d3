package com.tunechat.match.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.resilience")
public class MatchResilienceProperties {
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;
    private int annFailureThreshold = 3;
    private long annOpenMs = 15000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getAnnFailureThreshold() {
        return annFailureThreshold;
    }

    public void setAnnFailureThreshold(int annFailureThreshold) {
        this.annFailureThreshold = annFailureThreshold;
    }

    public long getAnnOpenMs() {
        return annOpenMs;
    }

    public void setAnnOpenMs(long annOpenMs) {
        this.annOpenMs = annOpenMs;
    }
}
