package com.parcel.search.engine;

/**
 * Executes a structured query against the record index.
 */
public interface SearchEngine {
    EngineResponse execute(EngineQuery query);
}
