package com.parcel.search.resilience;

import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private final SearchResilienceProperties properties;
    private final CircuitBreaker embedBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.properties = properties;
        this.embedBreaker = new CircuitBreaker(properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs());
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public SearchResilienceProperties getProperties() {
        return properties;
    }
}
