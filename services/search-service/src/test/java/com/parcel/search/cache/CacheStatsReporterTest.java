package com.parcel.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CacheStatsReporterTest {

    @Test
    void hitRateIsPercentageWithTwoDecimals() {
        assertThat(CacheStatsReporter.hitRate(0, 0)).isEqualTo(0.0);
        assertThat(CacheStatsReporter.hitRate(1, 2)).isEqualTo(33.33);
        assertThat(CacheStatsReporter.hitRate(2, 1)).isEqualTo(66.67);
        assertThat(CacheStatsReporter.hitRate(5, 0)).isEqualTo(100.0);
    }

    @Test
    void reportCoversEveryNamespace() {
        SearchCacheProperties properties = new SearchCacheProperties();
        properties.getEmbedding().setEnabled(false);
        InMemoryCacheBackend backend = new InMemoryCacheBackend(100, new MutableClock(Instant.EPOCH));
        CacheCoordinator coordinator = new CacheCoordinator(backend, properties, new ObjectMapper());
        CacheStatsReporter reporter = new CacheStatsReporter(coordinator, properties);

        coordinator.getFilterPlan("pool");
        coordinator.recordQuery("pool");

        CacheStatsReport report = reporter.report();

        assertThat(report.backend()).isEqualTo("memory");
        assertThat(report.namespaces()).containsOnlyKeys("filter_plan", "embedding", "query_result");
        assertThat(report.namespaces().get("filter_plan").misses()).isEqualTo(1L);
        assertThat(report.namespaces().get("filter_plan").ttlSeconds()).isEqualTo(600L);
        assertThat(report.namespaces().get("embedding").enabled()).isFalse();
        assertThat(report.namespaces().get("query_result").ttlSeconds()).isEqualTo(300L);
        assertThat(report.popularQueries()).containsExactly(new PopularQuery("pool", 1L));
        assertThat(reporter.health().status()).isEqualTo("healthy");
    }
}
