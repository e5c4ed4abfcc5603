package com.adlanda.citedsearch.exception;

/**
 * Writing records to the vector index failed.
 *
 * Treated as transient by the ingestion retry policy.
 */
public class IndexUpsertException extends CitedSearchException {

    public IndexUpsertException(String message) {
        super(message);
    }

    public IndexUpsertException(String message, Throwable cause) {
        super(message, cause);
    }
}
