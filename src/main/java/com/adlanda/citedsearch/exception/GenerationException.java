package com.adlanda.citedsearch.exception;

/**
 * The generation model stream failed.
 */
public class GenerationException extends CitedSearchException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
