package com.adlanda.citedsearch.exception;

/**
 * Malformed query parameters. Never retried.
 */
public class QueryValidationException extends CitedSearchException {

    public QueryValidationException(String message) {
        super(message);
    }
}
