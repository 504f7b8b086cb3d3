package com.tunechat.match.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the sentence-embedding model server. One text per call; transport errors and 5xx
 * responses are retried up to {@code embedding.http.retry-count} times, 4xx never.
 */
@Component
public class EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        EmbeddingProperties.Http http = properties.getHttp();
        if (http.getBaseUrl() == null || http.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbedRequest> entity = new HttpEntity<>(
            new EmbedRequest(properties.getModel(), List.of(text), true),
            headers
        );
        String url = endpoint(http.getBaseUrl());

        int retries = Math.max(0, http.getRetryCount());
        EmbeddingUnavailableException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbedResponse> response = restTemplate.exchange(
                    url,
                    HttpMethod.POST,
                    entity,
                    EmbedResponse.class
                );
                return firstVector(response.getBody());
            } catch (ResourceAccessException e) {
                String reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                last = new EmbeddingUnavailableException(reason, e);
            } catch (HttpStatusCodeException e) {
                last = new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                if (e.getStatusCode().is4xxClientError()) {
                    break;
                }
            } catch (RestClientException e) {
                last = new EmbeddingUnavailableException("embed_bad_response", e);
            }
            if (attempt < retries) {
                log.debug("embedding attempt {} failed ({}), retrying", attempt + 1, last.getMessage());
            }
        }
        throw last;
    }

    private List<Double> firstVector(EmbedResponse body) {
        if (body == null || body.vectors() == null || body.vectors().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.vectors().get(0);
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        return vector;
    }

    private static String endpoint(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/v1/embed";
    }

    public record EmbedRequest(String model, List<String> texts, boolean normalize) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbedResponse(String model, List<List<Double>> vectors) {
    }
}
