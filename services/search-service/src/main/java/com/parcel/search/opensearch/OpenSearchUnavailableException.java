package com.parcel.search.opensearch;

import com.parcel.search.engine.SearchEngineException;

public class OpenSearchUnavailableException extends SearchEngineException {
    public OpenSearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
