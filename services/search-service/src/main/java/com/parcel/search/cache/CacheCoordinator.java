package com.parcel.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.parcel.search.embed.EmbeddingVector;
import com.parcel.search.filter.FilterPlan;
import com.parcel.search.service.SearchResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the filter-plan, embedding and result caches on top of one {@link CacheBackend}.
 *
 * <p>Caching is an optimization only. Any backend or serialization failure is logged and turned
 * into a miss (reads), a no-op (writes) or zero (clears and counters); nothing thrown by the
 * backend leaves this class.
 */
@Service
public class CacheCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(CacheCoordinator.class);

    static final String STATS_PREFIX = "stats:";
    static final String POPULAR_PREFIX = "popular:";
    static final String POPULAR_KEY = POPULAR_PREFIX + "queries";

    private final CacheBackend backend;
    private final SearchCacheProperties properties;
    private final ObjectMapper objectMapper;

    public CacheCoordinator(CacheBackend backend, SearchCacheProperties properties, ObjectMapper objectMapper) {
        this.backend = backend;
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public boolean isEnabled(CacheNamespace namespace) {
        return properties.namespace(namespace).isEnabled();
    }

    public Duration ttl(CacheNamespace namespace) {
        return Duration.ofSeconds(Math.max(1L, properties.namespace(namespace).getTtlSeconds()));
    }

    public String backendName() {
        return backend.name();
    }

    public Optional<FilterPlan> getFilterPlan(String normalizedText) {
        return get(CacheNamespace.FILTER_PLAN, CacheKeys.textKey(CacheNamespace.FILTER_PLAN, normalizedText), FilterPlan.class);
    }

    public void putFilterPlan(String normalizedText, FilterPlan plan) {
        put(CacheNamespace.FILTER_PLAN, CacheKeys.textKey(CacheNamespace.FILTER_PLAN, normalizedText), plan);
    }

    public Optional<EmbeddingVector> getEmbedding(String normalizedText) {
        return get(CacheNamespace.EMBEDDING, CacheKeys.textKey(CacheNamespace.EMBEDDING, normalizedText), EmbeddingVector.class);
    }

    public void putEmbedding(String normalizedText, EmbeddingVector vector) {
        put(CacheNamespace.EMBEDDING, CacheKeys.textKey(CacheNamespace.EMBEDDING, normalizedText), vector);
    }

    public Optional<SearchResult> getResult(String normalizedText, int page, FilterPlan plan) {
        String key = resultKey(normalizedText, page, plan);
        if (key == null) {
            return Optional.empty();
        }
        return get(CacheNamespace.RESULT, key, SearchResult.class);
    }

    public void putResult(String normalizedText, int page, FilterPlan plan, SearchResult result) {
        String key = resultKey(normalizedText, page, plan);
        if (key == null) {
            return;
        }
        put(CacheNamespace.RESULT, key, result);
    }

    /** Returns null when the plan cannot be serialized, which callers treat as "do not cache". */
    public String resultKey(String normalizedText, int page, FilterPlan plan) {
        try {
            return CacheKeys.resultKey(normalizedText, page, canonicalJson(plan));
        } catch (JsonProcessingException e) {
            logger.debug("Failed to serialize filter plan for cache key: {}", e.getMessage());
            return null;
        }
    }

    public String canonicalJson(FilterPlan plan) throws JsonProcessingException {
        return objectMapper.writeValueAsString(plan == null ? FilterPlan.empty() : plan);
    }

    public <T> Optional<T> get(CacheNamespace namespace, String key, Class<T> type) {
        if (!isEnabled(namespace) || key == null) {
            return Optional.empty();
        }
        Optional<String> payload;
        try {
            payload = backend.get(key);
        } catch (Exception ex) {
            logger.debug("{} cache read failed: {}", namespace.getStatName(), ex.getMessage());
            return Optional.empty();
        }
        if (payload.isEmpty()) {
            recordMiss(namespace);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(payload.get(), type);
            recordHit(namespace);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException ex) {
            logger.debug("Discarding unreadable {} cache entry: {}", namespace.getStatName(), ex.getMessage());
            recordMiss(namespace);
            return Optional.empty();
        }
    }

    public <T> void put(CacheNamespace namespace, String key, T value) {
        if (!isEnabled(namespace) || key == null || value == null) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(value);
            backend.set(key, payload, ttl(namespace));
        } catch (JsonProcessingException ex) {
            logger.debug("Failed to serialize {} cache payload: {}", namespace.getStatName(), ex.getMessage());
        } catch (Exception ex) {
            logger.debug("{} cache write failed: {}", namespace.getStatName(), ex.getMessage());
        }
    }

    public long clear(CacheScope scope) {
        long removed = 0;
        for (CacheNamespace namespace : scope.getNamespaces()) {
            removed += deletePrefix(namespace.getPrefix());
        }
        if (scope == CacheScope.ALL) {
            removed += deletePrefix(STATS_PREFIX);
            removed += deletePrefix(POPULAR_PREFIX);
        }
        logger.info("Cleared {} cache keys (scope={})", removed, scope);
        return removed;
    }

    public void recordQuery(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return;
        }
        try {
            backend.incrementScore(POPULAR_KEY, normalizedText, 1.0, Duration.ofSeconds(properties.getPopularTtlSeconds()));
        } catch (Exception ex) {
            logger.debug("Failed to track popular query: {}", ex.getMessage());
        }
    }

    public List<PopularQuery> popularQueries(int limit) {
        try {
            List<PopularQuery> queries = new ArrayList<>();
            for (CacheBackend.ScoredMember member : backend.topScores(POPULAR_KEY, limit)) {
                queries.add(new PopularQuery(member.member(), Math.round(member.score())));
            }
            return queries;
        } catch (Exception ex) {
            logger.debug("Failed to read popular queries: {}", ex.getMessage());
            return List.of();
        }
    }

    public long hits(CacheNamespace namespace) {
        return counter(statKey(namespace, "hits"));
    }

    public long misses(CacheNamespace namespace) {
        return counter(statKey(namespace, "misses"));
    }

    public long totalKeys() {
        try {
            return backend.size();
        } catch (Exception ex) {
            logger.debug("Failed to read cache size: {}", ex.getMessage());
            return 0L;
        }
    }

    public CacheHealth health() {
        long started = System.nanoTime();
        try {
            backend.ping();
            double latencyMs = Math.round((System.nanoTime() - started) / 10_000.0) / 100.0;
            return CacheHealth.healthy(backend.name(), latencyMs);
        } catch (Exception ex) {
            return CacheHealth.unhealthy(backend.name(), ex.getMessage());
        }
    }

    private void recordHit(CacheNamespace namespace) {
        incrementStat(statKey(namespace, "hits"));
    }

    private void recordMiss(CacheNamespace namespace) {
        incrementStat(statKey(namespace, "misses"));
    }

    private void incrementStat(String key) {
        try {
            backend.increment(key, Duration.ofSeconds(properties.getStatsTtlSeconds()));
        } catch (Exception ex) {
            logger.debug("Failed to increment cache stat {}: {}", key, ex.getMessage());
        }
    }

    private long counter(String key) {
        try {
            return backend.getCounter(key);
        } catch (Exception ex) {
            logger.debug("Failed to read cache stat {}: {}", key, ex.getMessage());
            return 0L;
        }
    }

    private long deletePrefix(String prefix) {
        try {
            return backend.deleteByPrefix(prefix);
        } catch (Exception ex) {
            logger.debug("Failed to clear cache prefix {}: {}", prefix, ex.getMessage());
            return 0L;
        }
    }

    private static String statKey(CacheNamespace namespace, String kind) {
        return STATS_PREFIX + namespace.getStatName() + "_" + kind;
    }
}
