package com.parcel.search.cache;

import java.util.List;
import java.util.Locale;

public enum CacheScope {
    ALL(List.of(CacheNamespace.FILTER_PLAN, CacheNamespace.EMBEDDING, CacheNamespace.RESULT)),
    FILTER_PLAN(List.of(CacheNamespace.FILTER_PLAN)),
    EMBEDDING(List.of(CacheNamespace.EMBEDDING)),
    RESULT(List.of(CacheNamespace.RESULT));

    private final List<CacheNamespace> namespaces;

    CacheScope(List<CacheNamespace> namespaces) {
        this.namespaces = namespaces;
    }

    public List<CacheNamespace> getNamespaces() {
        return namespaces;
    }

    /**
     * Accepts the enum names as well as the short forms used by the admin endpoint
     * ({@code all}, {@code filters}, {@code embeddings}, {@code queries}).
     */
    public static CacheScope parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> ALL;
            case "filters", "filter", "filter_plan" -> FILTER_PLAN;
            case "embeddings", "embedding" -> EMBEDDING;
            case "queries", "query", "results", "result" -> RESULT;
            default -> throw new IllegalArgumentException("unknown cache scope: " + value);
        };
    }
}
