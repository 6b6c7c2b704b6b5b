package com.parcel.search.service;

import com.parcel.search.cache.CacheCoordinator;
import com.parcel.search.cache.CacheHealth;
import com.parcel.search.cache.CacheKeys;
import com.parcel.search.cache.CacheScope;
import com.parcel.search.cache.CacheStatsReport;
import com.parcel.search.cache.CacheStatsReporter;
import com.parcel.search.embed.EmbeddingGateway;
import com.parcel.search.embed.EmbeddingOutcome;
import com.parcel.search.engine.EngineQuery;
import com.parcel.search.engine.EngineResponse;
import com.parcel.search.engine.SearchEngine;
import com.parcel.search.engine.SearchEngineException;
import com.parcel.search.filter.FilterParser;
import com.parcel.search.filter.FilterPlan;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one natural-language property search: filter plan, optional result-cache short circuit,
 * embedding, then a hybrid or keyword-only engine query.
 */
@Service
public class HybridSearchService {
    private static final Logger logger = LoggerFactory.getLogger(HybridSearchService.class);

    private final FilterParser filterParser;
    private final EmbeddingGateway embeddingGateway;
    private final CacheCoordinator cacheCoordinator;
    private final CacheStatsReporter statsReporter;
    private final SearchEngine searchEngine;
    private final EngineQueryFactory queryFactory;
    private final SearchProperties properties;
    private final MeterRegistry meterRegistry;

    public HybridSearchService(
        FilterParser filterParser,
        EmbeddingGateway embeddingGateway,
        CacheCoordinator cacheCoordinator,
        CacheStatsReporter statsReporter,
        SearchEngine searchEngine,
        EngineQueryFactory queryFactory,
        SearchProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.filterParser = filterParser;
        this.embeddingGateway = embeddingGateway;
        this.cacheCoordinator = cacheCoordinator;
        this.statsReporter = statsReporter;
        this.searchEngine = searchEngine;
        this.queryFactory = queryFactory;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public SearchResult search(String queryText, int page, int size, boolean useCache) {
        return execute(queryText, page, size, useCache, true);
    }

    /**
     * Pre-computes page one of each query so a later identical request is served from the result
     * cache. Warming does not count towards query popularity.
     *
     * @return number of queries that completed; failures are logged and skipped
     */
    public int warmCache(List<String> queries) {
        int warmed = 0;
        for (String query : queries) {
            if (query == null || query.isBlank()) {
                continue;
            }
            try {
                execute(query, 1, properties.getDefaultPageSize(), true, false);
                warmed++;
            } catch (SearchEngineException | InvalidSearchRequestException e) {
                logger.warn("Cache warming skipped query '{}': {}", query, e.getMessage());
            }
        }
        return warmed;
    }

    public long clearCache(CacheScope scope) {
        return cacheCoordinator.clear(scope);
    }

    public CacheStatsReport getCacheStats() {
        return statsReporter.report();
    }

    public CacheHealth getCacheHealth() {
        return statsReporter.health();
    }

    private SearchResult execute(String queryText, int page, int size, boolean useCache, boolean trackPopularity) {
        validate(queryText, page, size);
        long startedAt = System.nanoTime();
        String normalized = CacheKeys.normalize(queryText);
        logger.debug("search stage={} page={} size={} useCache={}", SearchStage.START, page, size, useCache);

        if (useCache && trackPopularity) {
            cacheCoordinator.recordQuery(normalized);
        }

        FilterPlan plan = resolvePlan(queryText, normalized);
        long parseNanos = System.nanoTime() - startedAt;
        boolean resultCacheable = useCache && page == 1;

        if (resultCacheable) {
            Optional<SearchResult> cached = cacheCoordinator.getResult(normalized, page, plan);
            if (cached.isPresent()) {
                SearchResult served = cached.get().servedFromCache(
                    PerformanceBreakdown.millis(parseNanos),
                    PerformanceBreakdown.millis(System.nanoTime() - startedAt)
                );
                logger.debug("search stage={}", SearchStage.RESULT_CACHE_HIT);
                count(served);
                return served;
            }
        }
        logger.debug("search stage={} must={} filter={} sort={}", SearchStage.PLAN_READY,
            plan.getMust().size(), plan.getFilter().size(), plan.getSort().size());

        long embedStartedAt = System.nanoTime();
        EmbeddingOutcome embedding = embeddingGateway.embed(queryText);
        long embeddingNanos = System.nanoTime() - embedStartedAt;
        logger.debug("search stage={} success={} fromCache={}", SearchStage.EMBEDDING_ATTEMPTED,
            embedding.isSuccess(), embedding.isFromCache());

        EngineQuery engineQuery;
        SearchMethod method;
        if (embedding.isSuccess()) {
            engineQuery = queryFactory.hybrid(plan, embedding.getVector().get(), page, size);
            method = SearchMethod.HYBRID_SEMANTIC;
            logger.debug("search stage={}", SearchStage.HYBRID_QUERY);
        } else {
            logger.warn("Embedding unavailable ({}: {}), falling back to keyword-only search",
                embedding.getFailure(), embedding.getDetail());
            meterRegistry.counter("parcel.search.embedding.fallback",
                "reason", embedding.getFailure().name().toLowerCase(Locale.ROOT)).increment();
            engineQuery = queryFactory.keywordOnly(plan, page, size);
            method = SearchMethod.KEYWORD_ONLY;
            logger.debug("search stage={}", SearchStage.KEYWORD_QUERY);
        }

        long searchStartedAt = System.nanoTime();
        EngineResponse response;
        try {
            response = searchEngine.execute(engineQuery);
        } catch (SearchEngineException e) {
            logger.debug("search stage={}", SearchStage.FAILED);
            meterRegistry.counter("parcel.search.engine.failures", "method", method.tag()).increment();
            throw e;
        }
        long searchNanos = System.nanoTime() - searchStartedAt;
        logger.debug("search stage={} hits={} total={}", SearchStage.EXECUTED,
            response.hits().size(), response.totalMatches());

        PerformanceBreakdown performance = new PerformanceBreakdown(
            PerformanceBreakdown.millis(parseNanos),
            PerformanceBreakdown.millis(embeddingNanos),
            PerformanceBreakdown.millis(searchNanos),
            PerformanceBreakdown.millis(System.nanoTime() - startedAt),
            method,
            ServedFrom.SEARCH_ENGINE
        );
        SearchResult result = new SearchResult(
            response.hits(),
            response.totalMatches(),
            performance,
            ServedFrom.SEARCH_ENGINE
        );

        if (resultCacheable) {
            cacheCoordinator.putResult(normalized, page, plan, result);
            logger.debug("search stage={}", SearchStage.CACHED);
        } else {
            logger.debug("search stage={}", SearchStage.UNCACHED);
        }
        logger.debug("search stage={} method={} totalMs={}", SearchStage.DONE, method.tag(),
            performance.totalTimeMs());
        count(result);
        return result;
    }

    private FilterPlan resolvePlan(String queryText, String normalized) {
        Optional<FilterPlan> cached = cacheCoordinator.getFilterPlan(normalized);
        if (cached.isPresent()) {
            return cached.get();
        }
        FilterPlan plan = filterParser.parse(queryText);
        cacheCoordinator.putFilterPlan(normalized, plan);
        return plan;
    }

    private void validate(String queryText, int page, int size) {
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidSearchRequestException("query must not be blank");
        }
        if (queryText.length() > properties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException(
                "query must be at most " + properties.getMaxQueryLength() + " characters");
        }
        if (page < 1) {
            throw new InvalidSearchRequestException("page must be >= 1");
        }
        if (size < 1 || size > properties.getMaxPageSize()) {
            throw new InvalidSearchRequestException("size must be between 1 and " + properties.getMaxPageSize());
        }
        if ((long) (page - 1) * size > Integer.MAX_VALUE) {
            throw new InvalidSearchRequestException("page is out of range for size " + size);
        }
    }

    private void count(SearchResult result) {
        meterRegistry.counter("parcel.search.requests",
            "method", result.method() == null ? "unknown" : result.method().tag(),
            "served_from", result.servedFrom().tag()).increment();
    }
}
