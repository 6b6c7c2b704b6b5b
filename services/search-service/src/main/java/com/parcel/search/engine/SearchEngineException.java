package com.parcel.search.engine;

/**
 * The search engine could not answer a query. Not retried and not masked by the orchestrator.
 */
public class SearchEngineException extends RuntimeException {
    public SearchEngineException(String message) {
        super(message);
    }

    public SearchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
