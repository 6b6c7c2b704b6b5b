package com.parcel.search.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.parcel.search.engine.ScoredRecord;
import java.util.List;

/**
 * One page of hits plus how it was produced. Cached results are stored with the breakdown of the
 * request that computed them and get a fresh breakdown when served again.
 */
public record SearchResult(
    List<ScoredRecord> hits,
    @JsonProperty("total_matches") long totalMatches,
    PerformanceBreakdown performance,
    @JsonProperty("served_from") ServedFrom servedFrom
) {
    public SearchResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    @JsonIgnore
    public SearchMethod method() {
        return performance == null ? null : performance.method();
    }

    SearchResult servedFromCache(double parseTimeMs, double totalTimeMs) {
        PerformanceBreakdown breakdown = new PerformanceBreakdown(
            parseTimeMs,
            0.0,
            0.0,
            totalTimeMs,
            method(),
            ServedFrom.RESULT_CACHE
        );
        return new SearchResult(hits, totalMatches, breakdown, ServedFrom.RESULT_CACHE);
    }
}
