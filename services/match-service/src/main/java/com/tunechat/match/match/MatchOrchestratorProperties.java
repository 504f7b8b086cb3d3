package com.tunechat.match.match;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.orchestrator")
public class MatchOrchestratorProperties {
    private int recencyFloor = 5;
    private int fallbackSize = 3;
    private double fallbackScore = 0.3;
    private double confidenceThreshold = 0.7;
    private int maxAlternates = 2;
    private int historyWindow = 3;
    private List<String> explicitTags = List.of("explicit", "profanity", "adult");

    public int getRecencyFloor() {
        return recencyFloor;
    }

    public void setRecencyFloor(int recencyFloor) {
        this.recencyFloor = recencyFloor;
    }

    public int getFallbackSize() {
        return fallbackSize;
    }

    public void setFallbackSize(int fallbackSize) {
        this.fallbackSize = fallbackSize;
    }

    public double getFallbackScore() {
        return fallbackScore;
    }

    public void setFallbackScore(double fallbackScore) {
        this.fallbackScore = fallbackScore;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getMaxAlternates() {
        return maxAlternates;
    }

    public void setMaxAlternates(int maxAlternates) {
        this.maxAlternates = maxAlternates;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public List<String> getExplicitTags() {
        return explicitTags;
    }

    public void setExplicitTags(List<String> explicitTags) {
        this.explicitTags = explicitTags;
    }
}
