package com.parcel.search.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record CacheStatsReport(
    String backend,
    @JsonProperty("total_keys") long totalKeys,
    Map<String, NamespaceStats> namespaces,
    @JsonProperty("popular_queries") List<PopularQuery> popularQueries
) {
    public record NamespaceStats(
        boolean enabled,
        long hits,
        long misses,
        @JsonProperty("hit_rate") double hitRate,
        @JsonProperty("ttl_seconds") long ttlSeconds
    ) {
    }
}
