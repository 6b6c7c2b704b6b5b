package com.parcel.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for an OpenAI-compatible {@code /embeddings} endpoint (OpenAI, LM Studio, vLLM and the
 * like).
 */
public class HttpEmbeddingClient implements EmbeddingProvider {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public HttpEmbeddingClient(RestTemplate restTemplate, EmbeddingProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setInput(text);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplate.exchange(
                    buildUrl("/embeddings"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                EmbeddingResponse body = response.getBody();
                if (body == null || body.getData() == null || body.getData().isEmpty()) {
                    throw new EmbeddingUnavailableException("embed_empty_response");
                }
                List<Double> vector = body.getData().get(0).getEmbedding();
                if (vector == null || vector.isEmpty()) {
                    throw new EmbeddingUnavailableException("embed_empty_vector");
                }
                return vector;
            } catch (ResourceAccessException e) {
                if (attempt >= retries) {
                    String reason = "embed_unavailable";
                    if (e.getCause() instanceof java.net.SocketTimeoutException) {
                        reason = "embed_timeout";
                    }
                    throw new EmbeddingUnavailableException(reason, e);
                }
            } catch (HttpStatusCodeException e) {
                if (attempt >= retries) {
                    throw new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                }
            } catch (RestClientException e) {
                throw new EmbeddingUnavailableException("embed_malformed_response", e);
            }
        }
        throw new EmbeddingUnavailableException("embed_unavailable");
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private String input;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getInput() {
            return input;
        }

        public void setInput(String input) {
            this.input = input;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<Item> data;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<Item> getData() {
            return data;
        }

        public void setData(List<Item> data) {
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private int index;
        private List<Double> embedding;

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
