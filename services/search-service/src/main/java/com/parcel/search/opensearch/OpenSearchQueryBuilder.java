package com.parcel.search.opensearch;

import com.parcel.search.engine.EngineQuery;
import com.parcel.search.engine.VectorClause;
import com.parcel.search.filter.Condition;
import com.parcel.search.filter.SortClause;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an {@link EngineQuery} as OpenSearch query DSL.
 */
public class OpenSearchQueryBuilder {
    private final String vectorField;

    public OpenSearchQueryBuilder(String vectorField) {
        this.vectorField = vectorField;
    }

    public Map<String, Object> build(EngineQuery query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", query.getSize());
        body.put("from", query.getFrom());
        body.put("query", buildQuery(query));
        body.put("_source", Map.of("excludes", List.of(vectorField)));
        if (!query.getSort().isEmpty()) {
            List<Map<String, Object>> sort = new ArrayList<>();
            for (SortClause clause : query.getSort()) {
                sort.add(sortClause(clause));
            }
            body.put("sort", sort);
        }
        body.put("timeout", query.getTimeout().toMillis() + "ms");
        return body;
    }

    private Map<String, Object> buildQuery(EngineQuery query) {
        if (query.isMatchAll()) {
            return Map.of("match_all", Map.of());
        }
        List<Map<String, Object>> must = new ArrayList<>();
        if (query.hasVector()) {
            must.add(knnClause(query.getVector()));
        }
        for (Condition condition : query.getMust()) {
            must.add(condition(condition));
        }
        List<Map<String, Object>> filter = new ArrayList<>();
        for (Condition condition : query.getFilter()) {
            filter.add(condition(condition));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            bool.put("must", must);
        }
        if (!filter.isEmpty()) {
            bool.put("filter", filter);
        }
        return Map.of("bool", bool);
    }

    private Map<String, Object> knnClause(VectorClause clause) {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("vector", clause.vector());
        target.put("k", clause.k());
        return Map.of("knn", Map.of(clause.field(), target));
    }

    static Map<String, Object> condition(Condition condition) {
        if (condition instanceof Condition.Term term) {
            return term(term.field(), term.value());
        }
        if (condition instanceof Condition.Range range) {
            return range(range.field(), range.bound().operator(), range.value());
        }
        if (condition instanceof Condition.NestedRange nested) {
            return nested(nested.path(), range(nested.field(), nested.bound().operator(), nested.value()));
        }
        if (condition instanceof Condition.NestedTerm nested) {
            return nested(nested.path(), term(nested.field(), nested.value()));
        }
        throw new IllegalArgumentException("unsupported condition: " + condition);
    }

    static Map<String, Object> sortClause(SortClause clause) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("order", clause.order().value());
        if (clause.nestedPath() != null) {
            options.put("nested", Map.of("path", clause.nestedPath()));
        }
        return Map.of(clause.field(), options);
    }

    private static Map<String, Object> term(String field, Object value) {
        return Map.of("term", Map.of(field, value));
    }

    private static Map<String, Object> range(String field, String operator, Number value) {
        return Map.of("range", Map.of(field, Map.of(operator, value)));
    }

    private static Map<String, Object> nested(String path, Map<String, Object> query) {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("path", path);
        nested.put("query", query);
        return Map.of("nested", nested);
    }
}
