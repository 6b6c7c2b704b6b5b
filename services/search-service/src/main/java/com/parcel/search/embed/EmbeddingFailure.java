package com.parcel.search.embed;

public enum EmbeddingFailure {
    EMPTY_INPUT,
    DIMENSION_MISMATCH,
    UPSTREAM_ERROR
}
