package com.parcel.search.embed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Immutable embedding of one query text. Serialized as a plain JSON array.
 */
public final class EmbeddingVector {
    private final List<Double> values;

    private EmbeddingVector(List<Double> values) {
        this.values = List.copyOf(values);
    }

    @JsonCreator
    public static EmbeddingVector of(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("embedding vector must not be empty");
        }
        return new EmbeddingVector(values);
    }

    @JsonValue
    public List<Double> values() {
        return values;
    }

    public int dimension() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EmbeddingVector other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "EmbeddingVector{dimension=" + values.size() + "}";
    }
}
