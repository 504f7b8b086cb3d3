package com.tunechat.match.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    private boolean blocked;
    private String strategy;
    private Double confidence;
    private SongView primary;
    private List<SongView> alternates;
    private Why why;
    private ModerationView moderation;
    private PolicyView policy;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public boolean isBlocked() {
        return blocked;
    }

    public void setBlocked(boolean blocked) {
        this.blocked = blocked;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public SongView getPrimary() {
        return primary;
    }

    public void setPrimary(SongView primary) {
        this.primary = primary;
    }

    public List<SongView> getAlternates() {
        return alternates;
    }

    public void setAlternates(List<SongView> alternates) {
        this.alternates = alternates;
    }

    public Why getWhy() {
        return why;
    }

    public void setWhy(Why why) {
        this.why = why;
    }

    public ModerationView getModeration() {
        return moderation;
    }

    public void setModeration(ModerationView moderation) {
        this.moderation = moderation;
    }

    public PolicyView getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyView policy) {
        this.policy = policy;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SongView {
        private String id;
        private String title;
        private String artist;
        private Integer year;
        private int popularity;
        private List<String> tags;
        private Double score;
        private String strategy;

        @JsonProperty("canonical_id")
        private String canonicalId;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getArtist() {
            return artist;
        }

        public void setArtist(String artist) {
            this.artist = artist;
        }

        public Integer getYear() {
            return year;
        }

        public void setYear(Integer year) {
            this.year = year;
        }

        public int getPopularity() {
            return popularity;
        }

        public void setPopularity(int popularity) {
            this.popularity = popularity;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public Double getScore() {
            return score;
        }

        public void setScore(Double score) {
            this.score = score;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public String getCanonicalId() {
            return canonicalId;
        }

        public void setCanonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Why {
        @JsonProperty("matched_phrase")
        private String matchedPhrase;

        @JsonProperty("match_type")
        private String matchType;

        private Double similarity;
        private String mood;
        private List<String> tags;

        @JsonProperty("fallback_reason")
        private String fallbackReason;

        @JsonProperty("meta_distance")
        private Double metaDistance;

        @JsonProperty("aboutness_distance")
        private Double aboutnessDistance;

        @JsonProperty("primary_score")
        private double primaryScore;

        @JsonProperty("total_candidates")
        private int totalCandidates;

        public String getMatchedPhrase() {
            return matchedPhrase;
        }

        public void setMatchedPhrase(String matchedPhrase) {
            this.matchedPhrase = matchedPhrase;
        }

        public String getMatchType() {
            return matchType;
        }

        public void setMatchType(String matchType) {
            this.matchType = matchType;
        }

        public Double getSimilarity() {
            return similarity;
        }

        public void setSimilarity(Double similarity) {
            this.similarity = similarity;
        }

        public String getMood() {
            return mood;
        }

        public void setMood(String mood) {
            this.mood = mood;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public String getFallbackReason() {
            return fallbackReason;
        }

        public void setFallbackReason(String fallbackReason) {
            this.fallbackReason = fallbackReason;
        }

        public Double getMetaDistance() {
            return metaDistance;
        }

        public void setMetaDistance(Double metaDistance) {
            this.metaDistance = metaDistance;
        }

        public Double getAboutnessDistance() {
            return aboutnessDistance;
        }

        public void setAboutnessDistance(Double aboutnessDistance) {
            this.aboutnessDistance = aboutnessDistance;
        }

        public double getPrimaryScore() {
            return primaryScore;
        }

        public void setPrimaryScore(double primaryScore) {
            this.primaryScore = primaryScore;
        }

        public int getTotalCandidates() {
            return totalCandidates;
        }

        public void setTotalCandidates(int totalCandidates) {
            this.totalCandidates = totalCandidates;
        }
    }

    public static class ModerationView {
        private String category;

        @JsonProperty("was_filtered")
        private boolean wasFiltered;

        @JsonProperty("original_text")
        private String originalText;

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public boolean isWasFiltered() {
            return wasFiltered;
        }

        public void setWasFiltered(boolean wasFiltered) {
            this.wasFiltered = wasFiltered;
        }

        public String getOriginalText() {
            return originalText;
        }

        public void setOriginalText(String originalText) {
            this.originalText = originalText;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PolicyView {
        private String category;
        private String reason;
        private String message;

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
