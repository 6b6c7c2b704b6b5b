package com.parcel.search.service;

/**
 * Steps of one search request, in order. A request visits each step at most once; it ends in
 * {@link #DONE}, or in {@link #FAILED} when the engine call fails.
 */
public enum SearchStage {
    START,
    RESULT_CACHE_HIT,
    PLAN_READY,
    EMBEDDING_ATTEMPTED,
    HYBRID_QUERY,
    KEYWORD_QUERY,
    EXECUTED,
    CACHED,
    UNCACHED,
    DONE,
    FAILED
}
