package com.parcel.search.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured form of a free-text query.
 *
 * <p>{@code must} clauses take part in relevance scoring when combined with the vector clause,
 * {@code filter} clauses only gate. {@code sort} is empty unless the text carried an explicit
 * ordering intent, and never holds more than one clause.
 */
@JsonPropertyOrder({"must", "filter", "sort"})
public final class FilterPlan {
    private static final FilterPlan EMPTY = new FilterPlan(List.of(), List.of(), List.of());

    private final List<Condition> must;
    private final List<Condition> filter;
    private final List<SortClause> sort;

    @JsonCreator
    public FilterPlan(
        @JsonProperty("must") List<Condition> must,
        @JsonProperty("filter") List<Condition> filter,
        @JsonProperty("sort") List<SortClause> sort
    ) {
        this.must = must == null ? List.of() : List.copyOf(must);
        this.filter = filter == null ? List.of() : List.copyOf(filter);
        this.sort = sort == null ? List.of() : List.copyOf(sort);
    }

    public static FilterPlan empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Condition> getMust() {
        return must;
    }

    public List<Condition> getFilter() {
        return filter;
    }

    public List<SortClause> getSort() {
        return sort;
    }

    @JsonIgnore
    public boolean hasSort() {
        return !sort.isEmpty();
    }

    /** True when the text produced no condition at all; sort intent alone does not count. */
    @JsonIgnore
    public boolean hasNoConditions() {
        return must.isEmpty() && filter.isEmpty();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return hasNoConditions() && sort.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterPlan other)) {
            return false;
        }
        return must.equals(other.must) && filter.equals(other.filter) && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(must, filter, sort);
    }

    @Override
    public String toString() {
        return "FilterPlan{must=" + must + ", filter=" + filter + ", sort=" + sort + "}";
    }

    public static final class Builder {
        private final List<Condition> must = new ArrayList<>();
        private final List<Condition> filter = new ArrayList<>();
        private SortClause sort;

        private Builder() {
        }

        public Builder must(Condition condition) {
            must.add(condition);
            return this;
        }

        public Builder filter(Condition condition) {
            filter.add(condition);
            return this;
        }

        /** Keeps the first sort clause offered; later ones are ignored. */
        public Builder sort(SortClause clause) {
            if (sort == null) {
                sort = clause;
            }
            return this;
        }

        public FilterPlan build() {
            return new FilterPlan(must, filter, sort == null ? List.of() : List.of(sort));
        }
    }
}
