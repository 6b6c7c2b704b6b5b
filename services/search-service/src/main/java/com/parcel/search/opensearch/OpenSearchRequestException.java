package com.parcel.search.opensearch;

import com.parcel.search.engine.SearchEngineException;

public class OpenSearchRequestException extends SearchEngineException {
    public OpenSearchRequestException(String message) {
        super(message);
    }

    public OpenSearchRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
