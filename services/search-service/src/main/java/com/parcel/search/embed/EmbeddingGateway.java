package com.parcel.search.embed;

import com.parcel.search.cache.CacheCoordinator;
import com.parcel.search.cache.CacheKeys;
import com.parcel.search.resilience.CircuitBreaker;
import com.parcel.search.resilience.SearchResilienceRegistry;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cache-or-compute access to query embeddings.
 *
 * <p>Every problem with the provider (timeout, HTTP error, malformed payload, open breaker) is
 * reported as {@link EmbeddingFailure#UPSTREAM_ERROR}. A vector of the wrong length is reported as
 * {@link EmbeddingFailure#DIMENSION_MISMATCH} and is never cached, truncated or padded.
 */
@Component
public class EmbeddingGateway {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingProvider provider;
    private final EmbeddingProperties properties;
    private final CacheCoordinator cacheCoordinator;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingGateway(
        EmbeddingProvider provider,
        EmbeddingProperties properties,
        CacheCoordinator cacheCoordinator,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.provider = provider;
        this.properties = properties;
        this.cacheCoordinator = cacheCoordinator;
        this.resilienceRegistry = resilienceRegistry;
    }

    public EmbeddingOutcome embed(String text) {
        if (text == null || text.isBlank()) {
            return EmbeddingOutcome.failure(EmbeddingFailure.EMPTY_INPUT, "embed_empty_text");
        }
        String normalized = CacheKeys.normalize(text);
        Optional<EmbeddingVector> cached = cacheCoordinator.getEmbedding(normalized);
        if (cached.isPresent() && cached.get().dimension() == properties.getDimension()) {
            return EmbeddingOutcome.success(cached.get(), true);
        }

        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            return EmbeddingOutcome.failure(EmbeddingFailure.UPSTREAM_ERROR, "embed_circuit_open");
        }
        List<Double> values;
        try {
            values = provider.embed(text.trim());
        } catch (RuntimeException e) {
            breaker.recordFailure();
            logger.debug("Embedding provider failed: {}", e.getMessage());
            return EmbeddingOutcome.failure(EmbeddingFailure.UPSTREAM_ERROR, e.getMessage());
        }
        if (values == null || values.isEmpty()) {
            breaker.recordFailure();
            return EmbeddingOutcome.failure(EmbeddingFailure.UPSTREAM_ERROR, "embed_empty_vector");
        }
        if (!allFinite(values)) {
            breaker.recordFailure();
            return EmbeddingOutcome.failure(EmbeddingFailure.UPSTREAM_ERROR, "embed_malformed_vector");
        }
        breaker.recordSuccess();
        if (values.size() != properties.getDimension()) {
            return EmbeddingOutcome.failure(
                EmbeddingFailure.DIMENSION_MISMATCH,
                "expected " + properties.getDimension() + " dimensions, got " + values.size()
            );
        }
        EmbeddingVector vector = EmbeddingVector.of(values);
        cacheCoordinator.putEmbedding(normalized, vector);
        return EmbeddingOutcome.success(vector, false);
    }

    private static boolean allFinite(List<Double> values) {
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
