package com.parcel.search.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Read-only view over the coordinator's counters, popularity set and backend health.
 */
@Component
public class CacheStatsReporter {
    private final CacheCoordinator coordinator;
    private final SearchCacheProperties properties;

    public CacheStatsReporter(CacheCoordinator coordinator, SearchCacheProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    public CacheStatsReport report() {
        Map<String, CacheStatsReport.NamespaceStats> namespaces = new LinkedHashMap<>();
        for (CacheNamespace namespace : CacheNamespace.values()) {
            long hits = coordinator.hits(namespace);
            long misses = coordinator.misses(namespace);
            namespaces.put(namespace.getStatName(), new CacheStatsReport.NamespaceStats(
                coordinator.isEnabled(namespace),
                hits,
                misses,
                hitRate(hits, misses),
                coordinator.ttl(namespace).getSeconds()
            ));
        }
        return new CacheStatsReport(
            coordinator.backendName(),
            coordinator.totalKeys(),
            namespaces,
            coordinator.popularQueries(properties.getPopularLimit())
        );
    }

    public CacheHealth health() {
        return coordinator.health();
    }

    /** Percentage rounded to two decimals; zero when nothing was looked up yet. */
    static double hitRate(long hits, long misses) {
        long total = hits + misses;
        if (total <= 0) {
            return 0.0;
        }
        return Math.round(hits * 10000.0 / total) / 100.0;
    }
}
