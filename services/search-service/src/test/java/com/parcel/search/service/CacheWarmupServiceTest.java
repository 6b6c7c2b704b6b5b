package com.parcel.search.service;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parcel.search.cache.CacheCoordinator;
import com.parcel.search.cache.InMemoryCacheBackend;
import com.parcel.search.cache.SearchCacheProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CacheWarmupServiceTest {

    @Mock
    private HybridSearchService searchService;

    private final SearchCacheProperties properties = new SearchCacheProperties();
    private final CacheCoordinator coordinator =
        new CacheCoordinator(new InMemoryCacheBackend(100), properties, new ObjectMapper());

    @Test
    void disabledWarmingDoesNothing() {
        coordinator.recordQuery("pool homes");

        new CacheWarmupService(searchService, coordinator, properties).warmPopularQueries();

        verify(searchService, never()).warmCache(anyList());
    }

    @Test
    void warmsTopPopularQueriesInRankOrder() {
        properties.getWarming().setEnabled(true);
        properties.getWarming().setTopN(2);
        coordinator.recordQuery("condo");
        coordinator.recordQuery("pool homes");
        coordinator.recordQuery("pool homes");
        coordinator.recordQuery("acreage");
        coordinator.recordQuery("acreage");
        coordinator.recordQuery("acreage");
        when(searchService.warmCache(anyList())).thenReturn(2);

        new CacheWarmupService(searchService, coordinator, properties).warmPopularQueries();

        verify(searchService).warmCache(List.of("acreage", "pool homes"));
    }

    @Test
    void nothingPopularMeansNoWarming() {
        properties.getWarming().setEnabled(true);

        new CacheWarmupService(searchService, coordinator, properties).warmPopularQueries();

        verify(searchService, never()).warmCache(anyList());
    }
}
