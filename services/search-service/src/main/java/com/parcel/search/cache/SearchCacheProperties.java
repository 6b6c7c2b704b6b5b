package com.parcel.search.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.cache")
public class SearchCacheProperties {
    private String backend = "memory";
    private boolean fallbackToMemory = true;
    private int maxEntries = 10000;
    private long statsTtlSeconds = 86400;
    private long popularTtlSeconds = 1800;
    private int popularLimit = 10;
    private Namespace filterPlan = new Namespace(600);
    private Namespace embedding = new Namespace(3600);
    private Namespace result = new Namespace(300);
    private Warming warming = new Warming();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public boolean isFallbackToMemory() {
        return fallbackToMemory;
    }

    public void setFallbackToMemory(boolean fallbackToMemory) {
        this.fallbackToMemory = fallbackToMemory;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getStatsTtlSeconds() {
        return statsTtlSeconds;
    }

    public void setStatsTtlSeconds(long statsTtlSeconds) {
        this.statsTtlSeconds = statsTtlSeconds;
    }

    public long getPopularTtlSeconds() {
        return popularTtlSeconds;
    }

    public void setPopularTtlSeconds(long popularTtlSeconds) {
        this.popularTtlSeconds = popularTtlSeconds;
    }

    public int getPopularLimit() {
        return popularLimit;
    }

    public void setPopularLimit(int popularLimit) {
        this.popularLimit = popularLimit;
    }

    public Namespace getFilterPlan() {
        return filterPlan;
    }

    public void setFilterPlan(Namespace filterPlan) {
        this.filterPlan = filterPlan;
    }

    public Namespace getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Namespace embedding) {
        this.embedding = embedding;
    }

    public Namespace getResult() {
        return result;
    }

    public void setResult(Namespace result) {
        this.result = result;
    }

    public Warming getWarming() {
        return warming;
    }

    public void setWarming(Warming warming) {
        this.warming = warming;
    }

    public Namespace namespace(CacheNamespace namespace) {
        return switch (namespace) {
            case FILTER_PLAN -> filterPlan;
            case EMBEDDING -> embedding;
            case RESULT -> result;
        };
    }

    public static class Namespace {
        private boolean enabled = true;
        private long ttlSeconds;

        public Namespace() {
        }

        public Namespace(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }
    }

    public static class Warming {
        private boolean enabled = false;
        private long intervalMs = 1_800_000L;
        private int topN = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }
    }
}
