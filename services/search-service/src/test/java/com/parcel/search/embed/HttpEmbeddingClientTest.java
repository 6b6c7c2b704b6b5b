package com.parcel.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpEmbeddingClientTest {

    private static final String RESPONSE =
        "{\"object\":\"list\",\"model\":\"nomic\",\"data\":[{\"index\":0,\"embedding\":[0.5,-0.25,1.0]}]}";

    @Test
    void postsOpenAiCompatibleRequest() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        HttpEmbeddingClient client = new HttpEmbeddingClient(restTemplate, properties(0, "secret"));

        server.expect(requestTo("http://localhost:1234/v1/embeddings"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer secret"))
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.model").value("text-embedding-nomic-embed-text-v1.5"))
            .andExpect(jsonPath("$.input").value("pool homes in austin"))
            .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        List<Double> vector = client.embed("pool homes in austin");

        assertThat(vector).containsExactly(0.5, -0.25, 1.0);
        server.verify();
    }

    @Test
    void httpErrorIsReportedWithStatus() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        HttpEmbeddingClient client = new HttpEmbeddingClient(restTemplate, properties(0, null));

        server.expect(requestTo("http://localhost:1234/v1/embeddings"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.embed("condo"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_503");
    }

    @Test
    void retriesServerErrorsUpToRetryCount() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        HttpEmbeddingClient client = new HttpEmbeddingClient(restTemplate, properties(1, null));

        server.expect(requestTo("http://localhost:1234/v1/embeddings")).andRespond(withServerError());
        server.expect(requestTo("http://localhost:1234/v1/embeddings"))
            .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        assertThat(client.embed("condo")).hasSize(3);
        server.verify();
    }

    @Test
    void emptyDataIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        HttpEmbeddingClient client = new HttpEmbeddingClient(restTemplate, properties(0, null));

        server.expect(requestTo("http://localhost:1234/v1/embeddings"))
            .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.embed("condo"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_response");
    }

    private EmbeddingProperties properties(int retryCount, String apiKey) {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setBaseUrl("http://localhost:1234/v1/");
        properties.setApiKey(apiKey);
        properties.setRetryCount(retryCount);
        return properties;
    }
}
