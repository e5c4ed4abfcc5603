package com.adlanda.citedsearch.exception;

/**
 * A similarity query or existence lookup against the vector index failed.
 */
public class IndexQueryException extends CitedSearchException {

    public IndexQueryException(String message) {
        super(message);
    }

    public IndexQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
