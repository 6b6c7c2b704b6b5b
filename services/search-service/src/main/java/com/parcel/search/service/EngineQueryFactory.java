package com.parcel.search.service;

import com.parcel.search.embed.EmbeddingVector;
import com.parcel.search.engine.EngineQuery;
import com.parcel.search.engine.VectorClause;
import com.parcel.search.filter.FilterPlan;
import com.parcel.search.opensearch.OpenSearchProperties;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Turns a filter plan (and, when available, the query embedding) into an engine query.
 */
@Component
public class EngineQueryFactory {
    private final SearchProperties properties;
    private final String vectorField;

    public EngineQueryFactory(SearchProperties properties, OpenSearchProperties openSearchProperties) {
        this.properties = properties;
        this.vectorField = openSearchProperties.getVectorField();
    }

    /** Boolean clauses and sort only; an empty plan becomes a match-all query. */
    public EngineQuery keywordOnly(FilterPlan plan, int page, int size) {
        return EngineQuery.builder()
            .must(plan.getMust())
            .filter(plan.getFilter())
            .sort(plan.getSort())
            .from(offset(page, size))
            .size(size)
            .timeout(Duration.ofMillis(properties.getKeywordTimeoutMs()))
            .build();
    }

    /**
     * k-NN clause scored together with the plan's {@code must} clauses, the plan's {@code filter}
     * clauses as a non-scoring gate. An explicit sort replaces score ordering.
     */
    public EngineQuery hybrid(FilterPlan plan, EmbeddingVector vector, int page, int size) {
        return EngineQuery.builder()
            .vector(new VectorClause(vectorField, vector.values(), properties.getCandidatePool()))
            .must(plan.getMust())
            .filter(plan.getFilter())
            .sort(plan.getSort())
            .from(offset(page, size))
            .size(size)
            .timeout(Duration.ofMillis(properties.getHybridTimeoutMs()))
            .build();
    }

    /** Throws {@link ArithmeticException} when the offset does not fit the engine's int {@code from}. */
    static int offset(int page, int size) {
        return Math.toIntExact(Math.multiplyExact((long) Math.max(0, page - 1), size));
    }
}
