package com.parcel.search.engine;

import java.util.List;

public record EngineResponse(List<ScoredRecord> hits, long totalMatches, long tookMs) {
    public EngineResponse {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }
}
