package com.parcel.search.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ServedFrom {
    @JsonProperty("result_cache")
    RESULT_CACHE("result_cache"),
    @JsonProperty("search_engine")
    SEARCH_ENGINE("search_engine");

    private final String tag;

    ServedFrom(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
