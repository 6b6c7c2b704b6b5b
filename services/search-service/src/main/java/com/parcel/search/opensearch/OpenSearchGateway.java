package com.parcel.search.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parcel.search.engine.EngineQuery;
import com.parcel.search.engine.EngineResponse;
import com.parcel.search.engine.ScoredRecord;
import com.parcel.search.engine.SearchEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
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

@Component
public class OpenSearchGateway implements SearchEngine {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;
    private final OpenSearchQueryBuilder queryBuilder;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.queryBuilder = new OpenSearchQueryBuilder(properties.getVectorField());
    }

    @Override
    public EngineResponse execute(EngineQuery query) {
        Map<String, Object> body = queryBuilder.build(query);
        JsonNode response = postJson("/" + properties.getIndex() + "/_search", body);
        return new EngineResponse(extractHits(response), extractTotal(response), response.path("took").asLong(0L));
    }

    private JsonNode postJson(String path, Object body) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            headers.setBasicAuth(properties.getUsername(), properties.getPassword() == null ? "" : properties.getPassword());
        }
        try {
            String payload = objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                throw new OpenSearchRequestException("Empty OpenSearch response");
            }
            return objectMapper.readTree(responseBody);
        } catch (ResourceAccessException e) {
            throw new OpenSearchUnavailableException("OpenSearch unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (RestClientException e) {
            throw new OpenSearchRequestException("OpenSearch request failed", e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private List<ScoredRecord> extractHits(JsonNode response) {
        List<ScoredRecord> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            String id = hit.path("_id").asText(null);
            JsonNode scoreNode = hit.path("_score");
            Double score = scoreNode.isNumber() ? scoreNode.asDouble() : null;
            JsonNode source = hit.path("_source");
            hits.add(new ScoredRecord(id, score, source.isMissingNode() ? null : source));
        }
        return hits;
    }

    private long extractTotal(JsonNode response) {
        JsonNode total = response.path("hits").path("total");
        if (total.isNumber()) {
            return total.asLong();
        }
        return total.path("value").asLong(0L);
    }
}
