package com.adlanda.citedsearch.service.sparse;

import com.adlanda.citedsearch.model.SparseVector;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds BM25-weighted sparse vectors for lexical matching.
 *
 * <p><b>IDF is batch-local.</b> Document frequencies and the average document length are
 * computed over the texts passed to a single {@link #build(List)} call, not over the whole
 * corpus. This is an approximation of classic BM25: the same chunk indexed in a different
 * batch gets different weights, and a term that appears in more than half of a batch gets
 * an IDF of zero and is dropped. Callers must not assume weights are comparable across batches.
 *
 * <p>Per document and distinct non-special token:
 * <pre>
 * idf   = max(0, ln((N - df + 0.5) / (df + 0.5)))
 * score = idf * (tf * (k1 + 1)) / (tf + k1 * (1 - b + b * len / avgLen))
 * </pre>
 */
@Service
public class SparseVectorBuilder {

    public static final double K1 = 1.5;
    public static final double B = 0.75;

    /**
     * Ids reserved for special tokens (padding, start, end); never weighted.
     */
    public static final Set<Integer> SPECIAL_TOKEN_IDS = Set.of(0, 1, 2);

    private final Tokenizer tokenizer;

    public SparseVectorBuilder(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Builds one sparse vector per text, in input order.
     */
    public List<SparseVector> build(List<String> texts) {
        List<List<Integer>> tokenized = texts.stream()
                .map(tokenizer::encode)
                .toList();
        return buildFromTokens(tokenized);
    }

    /**
     * Builds the query-side vector: weight 1 for every distinct non-special token.
     *
     * A query scored as a batch of one gets {@code idf = ln(0.5 / 1.5) < 0} for every term,
     * i.e. an empty vector. The unit weights keep the query IDF-neutral instead, so the dot
     * product with an indexed document vector is that document's BM25 score for the query terms.
     */
    public SparseVector buildQuery(String text) {
        Map<Integer, Double> weights = new LinkedHashMap<>();
        for (Integer tokenId : tokenizer.encode(text)) {
            if (!SPECIAL_TOKEN_IDS.contains(tokenId)) {
                weights.put(tokenId, 1.0);
            }
        }
        return new SparseVector(weights);
    }

    List<SparseVector> buildFromTokens(List<List<Integer>> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }

        int totalDocs = documents.size();
        Map<Integer, Integer> docFreq = new HashMap<>();
        long totalLength = 0;
        for (List<Integer> tokenIds : documents) {
            totalLength += tokenIds.size();
            for (Integer tokenId : new HashSet<>(tokenIds)) {
                docFreq.merge(tokenId, 1, Integer::sum);
            }
        }
        double avgDocLength = (double) totalLength / totalDocs;

        return documents.stream()
                .map(tokenIds -> score(tokenIds, totalDocs, docFreq, avgDocLength))
                .toList();
    }

    private SparseVector score(List<Integer> tokenIds, int totalDocs, Map<Integer, Integer> docFreq,
                               double avgDocLength) {
        // Degenerate batch: nothing to normalize length against
        if (avgDocLength == 0.0 || tokenIds.isEmpty()) {
            return SparseVector.empty();
        }

        Map<Integer, Integer> termFreq = new LinkedHashMap<>();
        for (Integer tokenId : tokenIds) {
            termFreq.merge(tokenId, 1, Integer::sum);
        }

        int docLength = tokenIds.size();
        double lengthNorm = 1 - B + B * docLength / avgDocLength;

        Map<Integer, Double> weights = new LinkedHashMap<>();
        termFreq.forEach((tokenId, tf) -> {
            if (SPECIAL_TOKEN_IDS.contains(tokenId)) {
                return;
            }
            int df = docFreq.get(tokenId);
            double idf = Math.max(0.0, Math.log((totalDocs - df + 0.5) / (df + 0.5)));
            double score = idf * (tf * (K1 + 1)) / (tf + K1 * lengthNorm);
            if (score > 0.0) {
                weights.put(tokenId, score);
            }
        });
        return new SparseVector(weights);
    }
}
