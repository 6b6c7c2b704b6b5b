package com.parcel.search.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheHealth(
    String status,
    String backend,
    boolean connected,
    @JsonProperty("response_time_ms") Double responseTimeMs,
    String error
) {
    public static CacheHealth healthy(String backend, double responseTimeMs) {
        return new CacheHealth("healthy", backend, true, responseTimeMs, null);
    }

    public static CacheHealth unhealthy(String backend, String error) {
        return new CacheHealth("unhealthy", backend, false, null, error);
    }
}
