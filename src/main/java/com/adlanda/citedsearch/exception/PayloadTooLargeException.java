package com.adlanda.citedsearch.exception;

/**
 * The upsert request exceeded the index's request size limit.
 *
 * The ingestion batcher reacts by halving the sub-batch size instead of retrying
 * the same request.
 */
public class PayloadTooLargeException extends IndexUpsertException {

    private final int recordCount;

    public PayloadTooLargeException(int recordCount, String message) {
        super(message);
        this.recordCount = recordCount;
    }

    public int getRecordCount() {
        return recordCount;
    }
}
