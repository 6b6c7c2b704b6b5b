package com.parcel.search.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One hit. {@code score} is only comparable with other scores of the same result set and is null
 * when the engine sorted by a field instead of relevance.
 */
public record ScoredRecord(String id, Double score, JsonNode source) {
}
