package com.tunechat.match.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    private static final String EMBED_URL = "http://localhost:8010/v1/embed";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void postsSingleTextAndReturnsFirstVector() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(1));

        server.expect(requestTo(EMBED_URL))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("texts").get(0).asText()).isEqualTo("walking on sunshine");
                assertThat(root.path("normalize").asBoolean()).isTrue();
                assertThat(root.path("model").asText()).isEqualTo("all-MiniLM-L6-v2");
            })
            .andRespond(withSuccess("{\"vectors\":[[0.1,0.2,0.3],[0.9,0.9,0.9]]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.embed("walking on sunshine")).containsExactly(0.1, 0.2, 0.3);
        server.verify();
    }

    @Test
    void retriesServerErrorsUpToRetryCount() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(1));

        server.expect(requestTo(EMBED_URL)).andRespond(withServerError());
        server.expect(requestTo(EMBED_URL))
            .andRespond(withSuccess("{\"vectors\":[[0.5,0.5]]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.embed("hello")).containsExactly(0.5, 0.5);
        server.verify();
    }

    @Test
    void clientErrorsAreNotRetried() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(2));

        server.expect(requestTo(EMBED_URL)).andRespond(withBadRequest());

        assertThatThrownBy(() -> gateway.embed("hello"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_400");
        server.verify();
    }

    @Test
    void timeoutIsReportedAfterLastAttempt() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(0));

        server.expect(requestTo(EMBED_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.embed("hello"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_timeout");
        server.verify();
    }

    @Test
    void emptyResponseIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(0));

        server.expect(requestTo(EMBED_URL)).andRespond(withSuccess("{\"vectors\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("hello")).hasMessage("embed_empty_response");
    }

    @Test
    void unreadableBodyIsRetriedThenUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties(1));

        server.expect(requestTo(EMBED_URL)).andRespond(withSuccess("<html>oops</html>", MediaType.APPLICATION_JSON));
        server.expect(requestTo(EMBED_URL)).andRespond(withSuccess("{\"vectors\": [[0.1,", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("hello"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_bad_response");
        server.verify();
    }

    @Test
    void missingBaseUrlFailsWithoutCalling() {
        EmbeddingProperties props = properties(0);
        props.getHttp().setBaseUrl(" ");
        EmbeddingGateway gateway = new EmbeddingGateway(new RestTemplate(), props);

        assertThatThrownBy(() -> gateway.embed("hello")).hasMessage("embed_base_url_missing");
    }

    private EmbeddingProperties properties(int retryCount) {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getHttp().setBaseUrl("http://localhost:8010/");
        props.getHttp().setRetryCount(retryCount);
        return props;
    }
}
