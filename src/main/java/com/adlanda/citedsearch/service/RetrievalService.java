package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.IndexQueryException;
import com.adlanda.citedsearch.exception.OperationCancelledException;
import com.adlanda.citedsearch.exception.QueryValidationException;
import com.adlanda.citedsearch.model.Chunk;
import com.adlanda.citedsearch.model.SearchQuery;
import com.adlanda.citedsearch.model.SearchResponse;
import com.adlanda.citedsearch.model.SearchResult;
import com.adlanda.citedsearch.model.SparseVector;
import com.adlanda.citedsearch.model.VectorRecord;
import com.adlanda.citedsearch.repository.IndexMatch;
import com.adlanda.citedsearch.repository.IndexQuery;
import com.adlanda.citedsearch.repository.MetadataFilter;
import com.adlanda.citedsearch.repository.VectorIndex;
import com.adlanda.citedsearch.repository.VectorIndex.LexicalSupport;
import com.adlanda.citedsearch.service.sparse.SparseVectorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Service responsible for hybrid retrieval of document passages.
 *
 * Orchestrates the query flow:
 * 1. Validate and embed the query
 * 2. Add the lexical signal the index can use (client sparse vector, raw text, or nothing)
 * 3. Query the index with the metadata filter and blend weight
 * 4. Return ranked results with 1-based page numbers
 *
 * Nothing is retried or cached here; collaborator failures reach the caller.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private static final String INDEX_QUERY = "index query";

    private final EmbeddingService embeddingService;
    private final SparseVectorBuilder sparseVectorBuilder;
    private final VectorIndex vectorIndex;
    private final TimeLimitedCalls timeLimitedCalls;
    private final RetrievalProperties retrievalProperties;

    public RetrievalService(EmbeddingService embeddingService,
                            SparseVectorBuilder sparseVectorBuilder,
                            VectorIndex vectorIndex,
                            TimeLimitedCalls timeLimitedCalls,
                            RetrievalProperties retrievalProperties) {
        this.embeddingService = embeddingService;
        this.sparseVectorBuilder = sparseVectorBuilder;
        this.vectorIndex = vectorIndex;
        this.timeLimitedCalls = timeLimitedCalls;
        this.retrievalProperties = retrievalProperties;
    }

    /**
     * Runs a hybrid search.
     *
     * @param query The query text, result count, optional filters and blend weight
     * @return At most {@code topK} results (configured default when unset), in index rank order; empty when the filter matches nothing
     * @throws QueryValidationException for blank text or out-of-range topK/alpha
     * @throws com.adlanda.citedsearch.exception.EmbeddingException if the query cannot be embedded
     * @throws IndexQueryException if the index query fails
     * @throws CollaboratorTimeoutException if a collaborator misses its deadline
     */
    public SearchResponse search(SearchQuery query) {
        int topK = effectiveTopK(query);
        validate(query, topK);
        long startTime = System.currentTimeMillis();

        List<Double> queryEmbedding = embeddingService.embed(query.text());

        LexicalSupport lexicalSupport = vectorIndex.lexicalSupport();
        SparseVector sparse = lexicalSupport == LexicalSupport.CLIENT_SPARSE
                ? sparseVectorBuilder.buildQuery(query.text())
                : null;
        String lexicalText = lexicalSupport == LexicalSupport.INDEX_SIDE ? query.text() : null;
        double alpha = lexicalSupport == LexicalSupport.NONE ? 1.0 : effectiveAlpha(query);

        IndexQuery indexQuery = new IndexQuery(
                queryEmbedding,
                sparse,
                lexicalText,
                MetadataFilter.of(query.fileFilter(), query.categoryFilter()),
                topK,
                alpha
        );

        List<IndexMatch> matches = callIndex(() -> vectorIndex.query(indexQuery));
        List<SearchResult> results = matches.stream()
                .limit(topK)
                .map(this::toResult)
                .toList();
        long indexSize = callIndex(vectorIndex::size);

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query '{}' (alpha={}, filter={}) returned {} results in {}ms",
                truncate(query.text(), 50), alpha, indexQuery.filter().equalities(), results.size(), queryTimeMs);

        return new SearchResponse(results, indexSize, queryTimeMs);
    }

    /**
     * Returns the number of records in the index.
     */
    public long getIndexSize() {
        return callIndex(vectorIndex::size);
    }

    private void validate(SearchQuery query, int topK) {
        if (query.text() == null || query.text().isBlank()) {
            throw new QueryValidationException("Query text must not be blank");
        }
        int maxTopK = retrievalProperties.getMaxTopK();
        if (topK < 1 || topK > maxTopK) {
            throw new QueryValidationException("topK must be between 1 and " + maxTopK + ", got " + topK);
        }
        Double alpha = query.alpha();
        if (alpha != null && (alpha.isNaN() || alpha < 0.0 || alpha > 1.0)) {
            throw new QueryValidationException("alpha must be between 0 and 1, got " + alpha);
        }
    }

    private int effectiveTopK(SearchQuery query) {
        return query.topK() != null ? query.topK() : retrievalProperties.getDefaultTopK();
    }

    private double effectiveAlpha(SearchQuery query) {
        return query.alpha() != null ? query.alpha() : retrievalProperties.getDefaultAlpha();
    }

    private <T> T callIndex(Callable<T> call) {
        Duration timeout = retrievalProperties.getIndexTimeout();
        try {
            return timeLimitedCalls.call(INDEX_QUERY, timeout, call);
        } catch (IndexQueryException | CollaboratorTimeoutException | OperationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexQueryException("Index query failed: " + e.getMessage(), e);
        }
    }

    private SearchResult toResult(IndexMatch match) {
        Map<String, Object> metadata = match.metadata();
        Object text = metadata.get(VectorRecord.TEXT);
        Object filename = metadata.get(Chunk.FILENAME);
        return new SearchResult(
                text != null ? text.toString() : "",
                filename != null ? filename.toString() : "unknown",
                SearchResult.coercePage(metadata.get(Chunk.PAGE_NUMBER)),
                match.score()
        );
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
