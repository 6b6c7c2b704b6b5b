package com.parcel.search.cache;

public enum CacheNamespace {
    FILTER_PLAN("filter:", "filter_plan"),
    EMBEDDING("embed:", "embedding"),
    RESULT("query:", "query_result");

    private final String prefix;
    private final String statName;

    CacheNamespace(String prefix, String statName) {
        this.prefix = prefix;
        this.statName = statName;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getStatName() {
        return statName;
    }
}
