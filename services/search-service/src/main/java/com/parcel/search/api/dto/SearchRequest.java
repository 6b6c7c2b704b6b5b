package com.parcel.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SearchRequest {
    private String query;
    private Integer page;
    private Integer size;

    @JsonProperty("use_cache")
    private Boolean useCache;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getSize() {
        return size;
    }

    public void setSize(Integer size) {
        this.size = size;
    }

    public Boolean getUseCache() {
        return useCache;
    }

    public void setUseCache(Boolean useCache) {
        this.useCache = useCache;
    }
}
