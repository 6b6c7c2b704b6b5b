package com.parcel.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
