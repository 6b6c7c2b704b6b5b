package com.parcel.search.filter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Objects;

/**
 * A single boolean clause of a {@link FilterPlan}. The set of shapes is closed so the query
 * builder can render every variant exhaustively.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Condition.Term.class, name = "term"),
    @JsonSubTypes.Type(value = Condition.Range.class, name = "range"),
    @JsonSubTypes.Type(value = Condition.NestedRange.class, name = "nested_range"),
    @JsonSubTypes.Type(value = Condition.NestedTerm.class, name = "nested_term")
})
public sealed interface Condition
    permits Condition.Term, Condition.Range, Condition.NestedRange, Condition.NestedTerm {

    String field();

    @JsonPropertyOrder({"field", "value"})
    record Term(String field, Object value) implements Condition {
        public Term {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    @JsonPropertyOrder({"field", "bound", "value"})
    record Range(String field, BoundKind bound, Number value) implements Condition {
        public Range {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(bound, "bound");
            Objects.requireNonNull(value, "value");
        }
    }

    @JsonPropertyOrder({"path", "field", "bound", "value"})
    record NestedRange(String path, String field, BoundKind bound, Number value) implements Condition {
        public NestedRange {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(bound, "bound");
            Objects.requireNonNull(value, "value");
        }
    }

    @JsonPropertyOrder({"path", "field", "value"})
    record NestedTerm(String path, String field, Object value) implements Condition {
        public NestedTerm {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }
}
