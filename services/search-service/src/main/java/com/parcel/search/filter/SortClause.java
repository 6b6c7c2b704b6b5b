package com.parcel.search.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

@JsonPropertyOrder({"field", "order", "nested_path"})
public record SortClause(
    String field,
    SortOrder order,
    @JsonProperty("nested_path") @JsonInclude(JsonInclude.Include.NON_NULL) String nestedPath
) {
    public SortClause {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(order, "order");
    }

    public static SortClause of(String field, SortOrder order) {
        return new SortClause(field, order, null);
    }

    public static SortClause nested(String path, String field, SortOrder order) {
        return new SortClause(field, order, path);
    }
}
