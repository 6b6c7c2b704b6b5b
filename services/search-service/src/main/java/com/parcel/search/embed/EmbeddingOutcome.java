package com.parcel.search.embed;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of asking the {@link EmbeddingGateway} for a vector: either a vector or the reason there
 * is none. A failure is never thrown; the caller decides how to degrade.
 */
public final class EmbeddingOutcome {
    private final EmbeddingVector vector;
    private final EmbeddingFailure failure;
    private final String detail;
    private final boolean fromCache;

    private EmbeddingOutcome(EmbeddingVector vector, EmbeddingFailure failure, String detail, boolean fromCache) {
        this.vector = vector;
        this.failure = failure;
        this.detail = detail;
        this.fromCache = fromCache;
    }

    public static EmbeddingOutcome success(EmbeddingVector vector, boolean fromCache) {
        return new EmbeddingOutcome(Objects.requireNonNull(vector, "vector"), null, null, fromCache);
    }

    public static EmbeddingOutcome failure(EmbeddingFailure failure, String detail) {
        return new EmbeddingOutcome(null, Objects.requireNonNull(failure, "failure"), detail, false);
    }

    public boolean isSuccess() {
        return vector != null;
    }

    public Optional<EmbeddingVector> getVector() {
        return Optional.ofNullable(vector);
    }

    public EmbeddingFailure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "EmbeddingOutcome{success, fromCache=" + fromCache + "}";
        }
        return "EmbeddingOutcome{failure=" + failure + ", detail=" + detail + "}";
    }
}
