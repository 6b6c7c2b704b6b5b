package com.parcel.search.embed;

import java.util.List;

/**
 * The embedding model behind the gateway. Implementations throw
 * {@link EmbeddingUnavailableException} (or any runtime exception) when no vector can be produced.
 */
public interface EmbeddingProvider {
    List<Double> embed(String text);
}
