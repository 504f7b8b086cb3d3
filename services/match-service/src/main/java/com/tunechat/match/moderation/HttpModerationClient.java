package com.tunechat.match.moderation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.SocketTimeoutException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

public class HttpModerationClient implements ModerationClient {
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpModerationClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public ModerationResult moderate(String text, ModerationConfig config) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ModerationUnavailableException("moderation_base_url_missing");
        }
        ModerateRequest request = new ModerateRequest();
        request.setText(text);
        request.setStrictMode(config.strictMode());
        request.setAllowNsfw(config.allowNsfw());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<ModerateResponse> response = restTemplate.exchange(
                buildUrl("/v1/moderate"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                ModerateResponse.class
            );
            ModerateResponse body = response.getBody();
            if (body == null || body.getAllowed() == null) {
                throw new ModerationUnavailableException("moderation_empty_response");
            }
            return new ModerationResult(
                body.getAllowed(),
                ModerationCategory.fromLabel(body.getCategory()),
                body.getConfidence() == null ? 0.0 : body.getConfidence(),
                body.getReason(),
                body.getReplacementText()
            );
        } catch (ResourceAccessException e) {
            String reason = e.getCause() instanceof SocketTimeoutException ? "moderation_timeout" : "moderation_unavailable";
            throw new ModerationUnavailableException(reason, e);
        } catch (HttpStatusCodeException e) {
            throw new ModerationUnavailableException("moderation_http_" + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ModerationUnavailableException("moderation_bad_response", e);
        }
    }

    private String buildUrl(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + path;
    }

    public static class ModerateRequest {
        private String text;
        @JsonProperty("strict_mode")
        private boolean strictMode;
        @JsonProperty("allow_nsfw")
        private boolean allowNsfw;

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public boolean isStrictMode() {
            return strictMode;
        }

        public void setStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
        }

        public boolean isAllowNsfw() {
            return allowNsfw;
        }

        public void setAllowNsfw(boolean allowNsfw) {
            this.allowNsfw = allowNsfw;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModerateResponse {
        private Boolean allowed;
        private String category;
        private Double confidence;
        private String reason;
        @JsonProperty("replacement_text")
        private String replacementText;

        public Boolean getAllowed() {
            return allowed;
        }

        public void setAllowed(Boolean allowed) {
            this.allowed = allowed;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public Double getConfidence() {
            return confidence;
        }

        public void setConfidence(Double confidence) {
            this.confidence = confidence;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }

        public String getReplacementText() {
            return replacementText;
        }

        public void setReplacementText(String replacementText) {
            this.replacementText = replacementText;
        }
    }
}
