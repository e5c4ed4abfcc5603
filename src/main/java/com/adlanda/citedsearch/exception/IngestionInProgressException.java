package com.adlanda.citedsearch.exception;

/**
 * An ingestion run was requested while another one is still running.
 */
public class IngestionInProgressException extends CitedSearchException {

    public IngestionInProgressException(String message) {
        super(message);
    }
}
