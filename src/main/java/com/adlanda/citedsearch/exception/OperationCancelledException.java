package com.adlanda.citedsearch.exception;

/**
 * The calling thread was interrupted while waiting for a collaborator.
 */
public class OperationCancelledException extends CitedSearchException {

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
