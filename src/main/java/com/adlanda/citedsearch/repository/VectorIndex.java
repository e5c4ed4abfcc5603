package com.adlanda.citedsearch.repository;

import com.adlanda.citedsearch.model.VectorRecord;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The vector index as seen by ingestion and search.
 *
 * Implementations are safe for concurrent use: any number of queries may run in
 * parallel with each other and with upserts.
 */
public interface VectorIndex {

    /**
     * How an index variant handles the lexical half of a hybrid query.
     */
    enum LexicalSupport {
        /** The index stores client-built sparse vectors and blends them with the dense score. */
        CLIENT_SPARSE,
        /** The index scores the raw query text itself (e.g. full-text search). */
        INDEX_SIDE,
        /** Dense similarity only. */
        NONE
    }

    /**
     * @return The subset of {@code ids} already present in the index
     */
    Set<String> existingIds(Collection<String> ids);

    /**
     * Inserts or replaces records by id, in one request.
     *
     * @throws com.adlanda.citedsearch.exception.PayloadTooLargeException when the request is too large
     * @throws com.adlanda.citedsearch.exception.IndexUpsertException     on any other write failure
     */
    void upsert(List<VectorRecord> records);

    /**
     * @return At most {@code query.topK()} matches, highest score first
     */
    List<IndexMatch> query(IndexQuery query);

    LexicalSupport lexicalSupport();

    /**
     * Returns the number of records stored.
     */
    long size();
}
