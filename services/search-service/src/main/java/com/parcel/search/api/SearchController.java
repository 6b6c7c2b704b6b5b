package com.parcel.search.api;

import com.parcel.search.api.dto.ErrorResponse;
import com.parcel.search.api.dto.SearchRequest;
import com.parcel.search.api.dto.WarmCacheRequest;
import com.parcel.search.cache.CacheHealth;
import com.parcel.search.cache.CacheScope;
import com.parcel.search.engine.SearchEngineException;
import com.parcel.search.opensearch.OpenSearchUnavailableException;
import com.parcel.search.service.HybridSearchService;
import com.parcel.search.service.InvalidSearchRequestException;
import com.parcel.search.service.SearchResult;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
    private static final int DEFAULT_PAGE = 1;
    private static final int DEFAULT_SIZE = 20;

    private final HybridSearchService searchService;

    public SearchController(HybridSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/api/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        int page = request.getPage() == null ? DEFAULT_PAGE : request.getPage();
        int size = request.getSize() == null ? DEFAULT_SIZE : request.getSize();
        boolean useCache = request.getUseCache() == null || request.getUseCache();
        try {
            SearchResult result = searchService.search(request.getQuery(), page, size, useCache);
            return ResponseEntity.ok(result);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (OpenSearchUnavailableException e) {
            logger.warn("Search engine unavailable [trace_id={}]: {}", traceId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("search_engine_unavailable", "Search engine is unavailable", traceId, requestId)
            );
        } catch (SearchEngineException e) {
            logger.warn("Search engine rejected query [trace_id={}]: {}", traceId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                new ErrorResponse("search_engine_error", "Search engine request failed", traceId, requestId)
            );
        } catch (Exception e) {
            logger.error("Search failed [trace_id={}]", traceId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @GetMapping("/api/cache/stats")
    public ResponseEntity<?> cacheStats() {
        return ResponseEntity.ok(searchService.getCacheStats());
    }

    @GetMapping("/api/cache/health")
    public ResponseEntity<CacheHealth> cacheHealth() {
        CacheHealth health = searchService.getCacheHealth();
        HttpStatus status = health.connected() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @PostMapping("/api/cache/clear")
    public ResponseEntity<?> clearCache(@RequestParam(value = "scope", required = false) String scope) {
        CacheScope parsed;
        try {
            parsed = CacheScope.parse(scope);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), null, null)
            );
        }
        long removed = searchService.clearCache(parsed);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scope", parsed.name().toLowerCase(Locale.ROOT));
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/api/cache/warm")
    public ResponseEntity<?> warmCache(@RequestBody(required = false) WarmCacheRequest request) {
        List<String> queries = request == null || request.getQueries() == null ? List.of() : request.getQueries();
        int warmed = searchService.warmCache(queries);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requested", queries.size());
        body.put("warmed", warmed);
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String traceId = normalizeOrGenerate(request.getHeader("x-trace-id"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", traceId, requestId)
        );
    }

    private String normalizeOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }
}
