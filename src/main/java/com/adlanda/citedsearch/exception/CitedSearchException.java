package com.adlanda.citedsearch.exception;

/**
 * Base type for all failures raised by the search, ingestion and answer pipeline.
 *
 * Unchecked so that collaborator failures propagate to the caller without
 * being declared on every service method.
 */
public class CitedSearchException extends RuntimeException {

    public CitedSearchException(String message) {
        super(message);
    }

    public CitedSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
