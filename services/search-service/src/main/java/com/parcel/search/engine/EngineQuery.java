package com.parcel.search.engine;

import com.parcel.search.filter.Condition;
import com.parcel.search.filter.SortClause;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Engine-neutral description of one search request.
 *
 * <p>{@code must} clauses score, {@code filter} clauses only gate. When a vector clause is present
 * it is scored together with {@code must}. A query with no clause at all matches every record.
 */
public final class EngineQuery {
    private final List<Condition> must;
    private final List<Condition> filter;
    private final VectorClause vector;
    private final List<SortClause> sort;
    private final int from;
    private final int size;
    private final Duration timeout;

    private EngineQuery(Builder builder) {
        this.must = List.copyOf(builder.must);
        this.filter = List.copyOf(builder.filter);
        this.vector = builder.vector;
        this.sort = List.copyOf(builder.sort);
        this.from = builder.from;
        this.size = builder.size;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
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

    public VectorClause getVector() {
        return vector;
    }

    public boolean hasVector() {
        return vector != null;
    }

    public List<SortClause> getSort() {
        return sort;
    }

    public int getFrom() {
        return from;
    }

    public int getSize() {
        return size;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isMatchAll() {
        return vector == null && must.isEmpty() && filter.isEmpty();
    }

    public static final class Builder {
        private List<Condition> must = List.of();
        private List<Condition> filter = List.of();
        private VectorClause vector;
        private List<SortClause> sort = List.of();
        private int from;
        private int size = 20;
        private Duration timeout = Duration.ofSeconds(1);

        private Builder() {
        }

        public Builder must(List<Condition> must) {
            this.must = must == null ? List.of() : must;
            return this;
        }

        public Builder filter(List<Condition> filter) {
            this.filter = filter == null ? List.of() : filter;
            return this;
        }

        public Builder vector(VectorClause vector) {
            this.vector = vector;
            return this;
        }

        public Builder sort(List<SortClause> sort) {
            this.sort = sort == null ? List.of() : sort;
            return this;
        }

        public Builder from(int from) {
            this.from = Math.max(0, from);
            return this;
        }

        public Builder size(int size) {
            this.size = Math.max(0, size);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public EngineQuery build() {
            return new EngineQuery(this);
        }
    }
}
