package com.legisgraph.citegraph.service.ingestion;

import org.springframework.http.HttpStatus;

/**
 * Ingestion failure with the HTTP status the admin endpoints answer with. 4xx means the
 * request was rejected before anything was written; 5xx means the graph store failed part way.
 */
public class IngestionException extends RuntimeException {

    private final HttpStatus status;

    public IngestionException(HttpStatus status, String message) {
        this(status, message, null);
    }

    public IngestionException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    static IngestionException badRequest(String message) {
        return new IngestionException(HttpStatus.BAD_REQUEST, message);
    }

    static IngestionException storeUnavailable(Throwable cause) {
        return new IngestionException(HttpStatus.INTERNAL_SERVER_ERROR, "Graph store is unavailable", cause);
    }

    public HttpStatus status() {
        return status;
    }

    public boolean isClientError() {
        return status.is4xxClientError();
    }
}
