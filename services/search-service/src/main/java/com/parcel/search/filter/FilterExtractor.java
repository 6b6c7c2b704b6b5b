package com.parcel.search.filter;

/**
 * Recognizes one attribute category in the query text and adds at most one clause for it.
 * Implementations must not depend on what other extractors contributed.
 */
@FunctionalInterface
public interface FilterExtractor {
    void extract(ParseInput input, FilterPlan.Builder plan);
}
