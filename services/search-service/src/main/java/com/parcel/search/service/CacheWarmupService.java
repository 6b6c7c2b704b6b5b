package com.parcel.search.service;

import com.parcel.search.cache.CacheCoordinator;
import com.parcel.search.cache.PopularQuery;
import com.parcel.search.cache.SearchCacheProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-runs the most popular queries so their first page sits in the result cache.
 */
@Component
public class CacheWarmupService {
    private static final Logger logger = LoggerFactory.getLogger(CacheWarmupService.class);

    private final HybridSearchService searchService;
    private final CacheCoordinator cacheCoordinator;
    private final SearchCacheProperties cacheProperties;

    public CacheWarmupService(
        HybridSearchService searchService,
        CacheCoordinator cacheCoordinator,
        SearchCacheProperties cacheProperties
    ) {
        this.searchService = searchService;
        this.cacheCoordinator = cacheCoordinator;
        this.cacheProperties = cacheProperties;
    }

    @Scheduled(
        initialDelayString = "${search.cache.warming.interval-ms:1800000}",
        fixedDelayString = "${search.cache.warming.interval-ms:1800000}"
    )
    public void warmPopularQueries() {
        if (!cacheProperties.getWarming().isEnabled()) {
            return;
        }
        List<String> queries = cacheCoordinator.popularQueries(cacheProperties.getWarming().getTopN())
            .stream()
            .map(PopularQuery::query)
            .toList();
        if (queries.isEmpty()) {
            return;
        }
        int warmed = searchService.warmCache(queries);
        logger.info("Cache warming finished: {}/{} popular queries warmed", warmed, queries.size());
    }
}
