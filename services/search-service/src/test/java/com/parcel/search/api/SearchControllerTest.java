package com.parcel.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.parcel.search.cache.CacheHealth;
import com.parcel.search.cache.CacheScope;
import com.parcel.search.cache.CacheStatsReport;
import com.parcel.search.cache.PopularQuery;
import com.parcel.search.engine.ScoredRecord;
import com.parcel.search.opensearch.OpenSearchRequestException;
import com.parcel.search.opensearch.OpenSearchUnavailableException;
import com.parcel.search.service.HybridSearchService;
import com.parcel.search.service.InvalidSearchRequestException;
import com.parcel.search.service.PerformanceBreakdown;
import com.parcel.search.service.SearchMethod;
import com.parcel.search.service.SearchResult;
import com.parcel.search.service.ServedFrom;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HybridSearchService hybridSearchService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void searchReturnsHitsAndPerformance() throws Exception {
        ScoredRecord hit = new ScoredRecord(
            "p-1", 3.5, JsonNodeFactory.instance.objectNode().put("parcel_id", "p-1"));
        PerformanceBreakdown performance = new PerformanceBreakdown(
            0.4, 20.0, 12.0, 33.0, SearchMethod.HYBRID_SEMANTIC, ServedFrom.SEARCH_ENGINE);
        when(hybridSearchService.search("pool homes in Austin", 1, 20, true))
            .thenReturn(new SearchResult(List.of(hit), 57L, performance, ServedFrom.SEARCH_ENGINE));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"pool homes in Austin\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hits[0].id").value("p-1"))
            .andExpect(jsonPath("$.hits[0].source.parcel_id").value("p-1"))
            .andExpect(jsonPath("$.total_matches").value(57))
            .andExpect(jsonPath("$.served_from").value("search_engine"))
            .andExpect(jsonPath("$.performance.method").value("hybrid_semantic"))
            .andExpect(jsonPath("$.performance.total_time_ms").value(33.0));
    }

    @Test
    void searchPassesExplicitPagingAndCacheFlag() throws Exception {
        PerformanceBreakdown performance = new PerformanceBreakdown(
            0.1, 0.0, 9.0, 9.5, SearchMethod.KEYWORD_ONLY, ServedFrom.SEARCH_ENGINE);
        when(hybridSearchService.search("condo", 3, 5, false))
            .thenReturn(new SearchResult(List.of(), 0L, performance, ServedFrom.SEARCH_ENGINE));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"condo\",\"page\":3,\"size\":5,\"use_cache\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.performance.method").value("keyword_only"));
    }

    @Test
    void invalidSearchIsBadRequest() throws Exception {
        when(hybridSearchService.search(any(), anyInt(), anyInt(), anyBoolean()))
            .thenThrow(new InvalidSearchRequestException("query must not be blank"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("query must not be blank"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/search")
                .header("x-trace-id", "trace-9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("invalid JSON"))
            .andExpect(jsonPath("$.trace_id").value("trace-9"));
    }

    @Test
    void unavailableEngineIsServiceUnavailable() throws Exception {
        when(hybridSearchService.search(anyString(), anyInt(), anyInt(), anyBoolean()))
            .thenThrow(new OpenSearchUnavailableException("OpenSearch unavailable: 503", null));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"condo\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("search_engine_unavailable"));
    }

    @Test
    void rejectedEngineQueryIsBadGateway() throws Exception {
        when(hybridSearchService.search(anyString(), anyInt(), anyInt(), anyBoolean()))
            .thenThrow(new OpenSearchRequestException("OpenSearch error: 400"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"condo\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error.code").value("search_engine_error"));
    }

    @Test
    void cacheStatsAreExposed() throws Exception {
        CacheStatsReport report = new CacheStatsReport(
            "memory",
            4L,
            Map.of("query_result", new CacheStatsReport.NamespaceStats(true, 3L, 1L, 75.0, 300L)),
            List.of(new PopularQuery("pool homes", 3L))
        );
        when(hybridSearchService.getCacheStats()).thenReturn(report);

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.backend").value("memory"))
            .andExpect(jsonPath("$.total_keys").value(4))
            .andExpect(jsonPath("$.namespaces.query_result.hit_rate").value(75.0))
            .andExpect(jsonPath("$.popular_queries[0].query").value("pool homes"));
    }

    @Test
    void unhealthyCacheIsServiceUnavailable() throws Exception {
        when(hybridSearchService.getCacheHealth()).thenReturn(CacheHealth.unhealthy("redis", "connection refused"));

        mockMvc.perform(get("/api/cache/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("unhealthy"))
            .andExpect(jsonPath("$.error").value("connection refused"));
    }

    @Test
    void clearUsesRequestedScope() throws Exception {
        when(hybridSearchService.clearCache(CacheScope.EMBEDDING)).thenReturn(12L);

        mockMvc.perform(post("/api/cache/clear").param("scope", "embeddings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("embedding"))
            .andExpect(jsonPath("$.removed").value(12));
    }

    @Test
    void clearRejectsUnknownScope() throws Exception {
        mockMvc.perform(post("/api/cache/clear").param("scope", "everything"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));

        verify(hybridSearchService, never()).clearCache(any());
    }

    @Test
    void warmReportsWarmedCount() throws Exception {
        when(hybridSearchService.warmCache(eq(List.of("pool homes", "condo")))).thenReturn(1);

        mockMvc.perform(post("/api/cache/warm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"queries\":[\"pool homes\",\"condo\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requested").value(2))
            .andExpect(jsonPath("$.warmed").value(1));
    }
}
