package com.adlanda.citedsearch.repository;

import com.adlanda.citedsearch.model.SparseVector;

import java.util.List;

/**
 * A similarity query issued against the vector index.
 *
 * @param dense   Query embedding
 * @param sparse  Query term weights, only set for {@link VectorIndex.LexicalSupport#CLIENT_SPARSE} indexes
 * @param text    Raw query text, used by {@link VectorIndex.LexicalSupport#INDEX_SIDE} indexes
 * @param filter  Metadata constraints; never null
 * @param topK    Maximum number of matches
 * @param alpha   Weight of the dense score; the lexical score gets {@code 1 - alpha}
 */
public record IndexQuery(
        List<Double> dense,
        SparseVector sparse,
        String text,
        MetadataFilter filter,
        int topK,
        double alpha
) {
    public IndexQuery {
        filter = filter != null ? filter : MetadataFilter.none();
    }
}
