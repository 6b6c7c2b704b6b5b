package com.parcel.search.api.dto;

import java.util.List;

public class WarmCacheRequest {
    private List<String> queries;

    public List<String> getQueries() {
        return queries;
    }

    public void setQueries(List<String> queries) {
        this.queries = queries;
    }
}
