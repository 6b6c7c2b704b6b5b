package com.parcel.search.cache;

public record PopularQuery(String query, long count) {
}
