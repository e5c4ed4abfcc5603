package com.adlanda.citedsearch.repository;

import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.exception.PayloadTooLargeException;
import com.adlanda.citedsearch.model.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory hybrid vector index.
 *
 * Scores each record as {@code alpha * cosine(dense) + (1 - alpha) * dot(sparse)}, the
 * convex combination used by hosted hybrid indexes. Ties keep insertion order; replacing
 * a record by id keeps its original position.
 */
@Repository
@ConditionalOnProperty(name = "citedsearch.retrieval.index-type", havingValue = "memory", matchIfMissing = true)
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, StoredRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxRecordsPerUpsert;

    public InMemoryVectorIndex(RetrievalProperties retrievalProperties) {
        this.maxRecordsPerUpsert = retrievalProperties.getMaxRecordsPerUpsert();
    }

    @Override
    public Set<String> existingIds(Collection<String> ids) {
        return ids.stream()
                .filter(records::containsKey)
                .collect(Collectors.toSet());
    }

    @Override
    public void upsert(List<VectorRecord> recordsToStore) {
        if (maxRecordsPerUpsert > 0 && recordsToStore.size() > maxRecordsPerUpsert) {
            throw new PayloadTooLargeException(recordsToStore.size(),
                    "Request size " + recordsToStore.size() + " exceeds the limit of "
                            + maxRecordsPerUpsert + " records");
        }
        for (VectorRecord record : recordsToStore) {
            if (!record.hasDense()) {
                throw new IllegalArgumentException("Cannot store record " + record.id() + " without dense vector");
            }
        }

        recordsToStore.forEach(record -> records.compute(record.id(), (id, existing) ->
                new StoredRecord(record, existing != null ? existing.sequence() : sequence.getAndIncrement())));
        log.debug("Upserted {} records, index size {}", recordsToStore.size(), records.size());
    }

    @Override
    public List<IndexMatch> query(IndexQuery query) {
        double alpha = query.alpha();
        return records.values().stream()
                .filter(stored -> query.filter().matches(stored.record().metadata()))
                .map(stored -> new ScoredRecord(stored, alpha * cosineSimilarity(query.dense(), stored.record().dense())
                        + (1 - alpha) * stored.record().sparse().dot(query.sparse())))
                .sorted(Comparator.comparingDouble(ScoredRecord::score).reversed()
                        .thenComparingLong(scored -> scored.stored().sequence()))
                .limit(query.topK())
                .map(scored -> new IndexMatch(scored.stored().record().id(), scored.score(),
                        scored.stored().record().metadata()))
                .toList();
    }

    @Override
    public LexicalSupport lexicalSupport() {
        return LexicalSupport.CLIENT_SPARSE;
    }

    @Override
    public long size() {
        return records.size();
    }

    /**
     * Clears all records from the index.
     */
    public void clear() {
        records.clear();
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return Similarity between -1 and 1 (1 = same direction); 0 when either vector has zero norm
     */
    private double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Vectors must have same dimension: " + a.size() + " vs " + b.size());
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.size(); i++) {
            dotProduct += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record StoredRecord(VectorRecord record, long sequence) {}

    private record ScoredRecord(StoredRecord stored, double score) {}
}
