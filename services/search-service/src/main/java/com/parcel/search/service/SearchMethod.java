package com.parcel.search.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SearchMethod {
    @JsonProperty("hybrid_semantic")
    HYBRID_SEMANTIC("hybrid_semantic"),
    @JsonProperty("keyword_only")
    KEYWORD_ONLY("keyword_only");

    private final String tag;

    SearchMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
