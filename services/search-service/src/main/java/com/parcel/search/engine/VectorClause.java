package com.parcel.search.engine;

import java.util.List;
import java.util.Objects;

/**
 * Approximate nearest-neighbour clause: the {@code k} closest documents to {@code vector} on
 * {@code field}.
 */
public record VectorClause(String field, List<Double> vector, int k) {
    public VectorClause {
        Objects.requireNonNull(field, "field");
        vector = List.copyOf(vector);
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
    }
}
