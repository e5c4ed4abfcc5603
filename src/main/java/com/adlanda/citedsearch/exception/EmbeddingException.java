package com.adlanda.citedsearch.exception;

/**
 * The embedding model failed or returned an unusable response.
 */
public class EmbeddingException extends CitedSearchException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
