package com.parcel.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int defaultPageSize = 20;
    private int maxPageSize = 100;
    private int maxQueryLength = 500;
    private int candidatePool = 100;
    private long hybridTimeoutMs = 1000;
    private long keywordTimeoutMs = 2000;

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getCandidatePool() {
        return candidatePool;
    }

    public void setCandidatePool(int candidatePool) {
        this.candidatePool = candidatePool;
    }

    public long getHybridTimeoutMs() {
        return hybridTimeoutMs;
    }

    public void setHybridTimeoutMs(long hybridTimeoutMs) {
        this.hybridTimeoutMs = hybridTimeoutMs;
    }

    public long getKeywordTimeoutMs() {
        return keywordTimeoutMs;
    }

    public void setKeywordTimeoutMs(long keywordTimeoutMs) {
        this.keywordTimeoutMs = keywordTimeoutMs;
    }
}
