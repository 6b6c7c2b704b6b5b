package com.parcel.search.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceBreakdown(
    @JsonProperty("parse_time_ms") double parseTimeMs,
    @JsonProperty("embedding_time_ms") double embeddingTimeMs,
    @JsonProperty("search_time_ms") double searchTimeMs,
    @JsonProperty("total_time_ms") double totalTimeMs,
    SearchMethod method,
    @JsonProperty("served_from") ServedFrom servedFrom
) {
    static double millis(long nanos) {
        return Math.round(nanos / 10_000.0) / 100.0;
    }
}
