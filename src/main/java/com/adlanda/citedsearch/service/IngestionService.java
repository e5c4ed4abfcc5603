package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.IngestionProperties;
import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.exception.CitedSearchException;
import com.adlanda.citedsearch.exception.OperationCancelledException;
import com.adlanda.citedsearch.exception.PayloadTooLargeException;
import com.adlanda.citedsearch.model.Chunk;
import com.adlanda.citedsearch.model.IngestionReport;
import com.adlanda.citedsearch.model.IngestionReport.FailedBatch;
import com.adlanda.citedsearch.model.SparseVector;
import com.adlanda.citedsearch.model.VectorRecord;
import com.adlanda.citedsearch.repository.VectorIndex;
import com.adlanda.citedsearch.repository.VectorIndex.LexicalSupport;
import com.adlanda.citedsearch.service.sparse.SparseVectorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service responsible for writing chunks into the vector index in idempotent batches.
 *
 * For every batch: ids already in the index (or already seen earlier in the same run) are
 * skipped, excluded element types and chunks with no text left after normalization are dropped,
 * the survivors are embedded in one bulk call, BM25-weighted over the same batch and upserted in
 * one request. Sparse vectors are only built for indexes that store them. Oversized requests are
 * split in half until they fit, and the reduced size is kept for the rest of the run. Other upsert
 * failures are retried with exponential backoff and, once retries run out, recorded in the report
 * while the run carries on with the next batch.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final String INDEX_EXISTS = "index existence check";
    private static final String INDEX_UPSERT = "index upsert";

    private final VectorIndex vectorIndex;
    private final EmbeddingService embeddingService;
    private final SparseVectorBuilder sparseVectorBuilder;
    private final ChunkTextNormalizer normalizer;
    private final TimeLimitedCalls timeLimitedCalls;
    private final RetryTemplate upsertRetryTemplate;
    private final Executor ingestionExecutor;
    private final IngestionProperties ingestionProperties;
    private final Duration indexTimeout;

    public IngestionService(VectorIndex vectorIndex,
                            EmbeddingService embeddingService,
                            SparseVectorBuilder sparseVectorBuilder,
                            ChunkTextNormalizer normalizer,
                            TimeLimitedCalls timeLimitedCalls,
                            RetryTemplate upsertRetryTemplate,
                            @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                            IngestionProperties ingestionProperties,
                            RetrievalProperties retrievalProperties) {
        this.vectorIndex = vectorIndex;
        this.embeddingService = embeddingService;
        this.sparseVectorBuilder = sparseVectorBuilder;
        this.normalizer = normalizer;
        this.timeLimitedCalls = timeLimitedCalls;
        this.upsertRetryTemplate = upsertRetryTemplate;
        this.ingestionExecutor = ingestionExecutor;
        this.ingestionProperties = ingestionProperties;
        this.indexTimeout = retrievalProperties.getIndexTimeout();
    }

    /**
     * Ingests chunks using the configured batch size.
     */
    public IngestionReport ingest(List<Chunk> chunks) {
        return ingest(chunks, ingestionProperties.getBatchSize());
    }

    /**
     * Ingests chunks in consecutive batches of {@code batchSize}.
     *
     * @param chunks    Chunks in source order
     * @param batchSize Maximum chunks per embedding call and upsert request; must be positive
     * @return Counts of processed, skipped, empty and excluded chunks plus any failed batches
     */
    public IngestionReport ingest(List<Chunk> chunks, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }

        long startNanos = System.nanoTime();
        IngestionReport.Accumulator accumulator = new IngestionReport.Accumulator();
        Set<String> seenIds = ConcurrentHashMap.newKeySet();
        AtomicInteger upsertLimit = new AtomicInteger(Integer.MAX_VALUE);
        List<List<Chunk>> batches = partition(chunks, batchSize);

        log.info("Ingesting {} chunks in {} batches of up to {}", chunks.size(), batches.size(), batchSize);

        if (ingestionProperties.getParallelism() <= 1 || batches.size() <= 1) {
            for (int i = 0; i < batches.size(); i++) {
                processBatch(i, batches.get(i), seenIds, upsertLimit, accumulator);
            }
        } else {
            runInParallel(batches, seenIds, upsertLimit, accumulator);
        }

        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        IngestionReport report = accumulator.toReport(elapsedSeconds);
        log.info("Ingestion finished in {}s: processed={}, skipped={}, empty={}, excluded={}, failedBatches={}",
                String.format(Locale.ROOT, "%.2f", elapsedSeconds), report.processed(), report.skipped(),
                report.empty(), report.excluded(), report.failedBatchCount());
        return report;
    }

    private void runInParallel(List<List<Chunk>> batches, Set<String> seenIds, AtomicInteger upsertLimit,
                               IngestionReport.Accumulator accumulator) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            int batchIndex = i;
            futures.add(CompletableFuture.runAsync(
                    () -> processBatch(batchIndex, batches.get(batchIndex), seenIds, upsertLimit, accumulator),
                    ingestionExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    void processBatch(int batchIndex, List<Chunk> batch, Set<String> seenIds, AtomicInteger upsertLimit,
                      IngestionReport.Accumulator accumulator) {
        List<Chunk> firstOccurrences = new ArrayList<>();
        for (Chunk chunk : batch) {
            if (seenIds.add(chunk.id())) {
                firstOccurrences.add(chunk);
            } else {
                accumulator.addSkipped(1);
            }
        }
        if (firstOccurrences.isEmpty()) {
            return;
        }

        List<String> ids = firstOccurrences.stream().map(Chunk::id).toList();
        Set<String> existing;
        try {
            existing = timeLimitedCalls.call(INDEX_EXISTS, indexTimeout, () -> vectorIndex.existingIds(ids));
        } catch (OperationCancelledException e) {
            throw e;
        } catch (CitedSearchException e) {
            recordFailure(accumulator, batchIndex, ids, e);
            return;
        }

        List<Chunk> pending = new ArrayList<>();
        for (Chunk chunk : firstOccurrences) {
            if (existing.contains(chunk.id())) {
                accumulator.addSkipped(1);
            } else if (chunk.type() != null && ingestionProperties.getExcludedTypes().contains(chunk.type())) {
                accumulator.addExcluded(1);
            } else {
                String text = normalizer.normalize(chunk.text());
                if (text.isEmpty()) {
                    accumulator.addEmpty(1);
                } else {
                    pending.add(chunk.withText(text));
                }
            }
        }
        if (pending.isEmpty()) {
            log.debug("Batch {}: nothing left to embed", batchIndex);
            return;
        }

        List<String> embeddingTexts = pending.stream().map(this::embeddingText).toList();
        List<List<Double>> dense;
        try {
            dense = embeddingService.embedAll(embeddingTexts);
        } catch (OperationCancelledException e) {
            throw e;
        } catch (CitedSearchException e) {
            recordFailure(accumulator, batchIndex, pending.stream().map(Chunk::id).toList(), e);
            return;
        }
        List<SparseVector> sparse = vectorIndex.lexicalSupport() == LexicalSupport.CLIENT_SPARSE
                ? sparseVectorBuilder.build(embeddingTexts)
                : null;

        List<VectorRecord> records = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            SparseVector weights = sparse != null ? sparse.get(i) : SparseVector.empty();
            records.add(toRecord(pending.get(i), embeddingTexts.get(i), dense.get(i), weights));
        }
        upsertShrinkingOnOverflow(batchIndex, records, upsertLimit, accumulator);
    }

    /**
     * Upserts records in sub-batches, halving the sub-batch size (down to 1) whenever the
     * index rejects a request as too large. A record still rejected on its own is recorded as
     * a failed batch. {@code upsertLimit} carries the smallest size reached into later batches.
     */
    private void upsertShrinkingOnOverflow(int batchIndex, List<VectorRecord> records, AtomicInteger upsertLimit,
                                           IngestionReport.Accumulator accumulator) {
        int subBatchSize = Math.min(records.size(), upsertLimit.get());
        int offset = 0;
        while (offset < records.size()) {
            List<VectorRecord> subBatch = records.subList(offset, Math.min(offset + subBatchSize, records.size()));
            try {
                upsertWithRetry(subBatch);
                accumulator.addProcessed(subBatch.size());
                offset += subBatch.size();
            } catch (PayloadTooLargeException e) {
                if (subBatchSize == 1) {
                    recordFailure(accumulator, batchIndex, recordIds(subBatch), e);
                    offset += 1;
                } else {
                    subBatchSize = Math.max(1, subBatchSize / 2);
                    upsertLimit.accumulateAndGet(subBatchSize, Math::min);
                    log.warn("Batch {}: request too large, reducing sub-batch size to {}", batchIndex, subBatchSize);
                }
            } catch (OperationCancelledException e) {
                throw e;
            } catch (CitedSearchException e) {
                recordFailure(accumulator, batchIndex, recordIds(subBatch), e);
                offset += subBatch.size();
            }
        }
        log.info("Batch {} completed: {} records", batchIndex, records.size());
    }

    private void upsertWithRetry(List<VectorRecord> subBatch) {
        upsertRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying upsert of {} records (attempt {}) after: {}",
                        subBatch.size(), context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            timeLimitedCalls.run(INDEX_UPSERT, indexTimeout, () -> vectorIndex.upsert(subBatch));
            return null;
        });
    }

    private VectorRecord toRecord(Chunk chunk, String embeddingText, List<Double> dense, SparseVector sparse) {
        Map<String, Object> metadata = new LinkedHashMap<>(chunk.metadata());
        metadata.put(VectorRecord.TEXT, chunk.text());
        if (ingestionProperties.isFilenamePrefix()) {
            metadata.put(VectorRecord.TEXT_WITH_FILENAME, embeddingText);
        }
        return new VectorRecord(chunk.id(), dense, sparse, metadata);
    }

    /**
     * Text sent to the embedding model: optionally prefixed with a readable document name
     * so that passages stay attributable to their manual.
     */
    String embeddingText(Chunk chunk) {
        if (!ingestionProperties.isFilenamePrefix() || chunk.filename() == null) {
            return chunk.text();
        }
        return "Document " + documentName(chunk.filename()) + ": " + chunk.text();
    }

    static String documentName(String filename) {
        String name = filename.toLowerCase(Locale.ROOT).endsWith(".pdf")
                ? filename.substring(0, filename.length() - 4)
                : filename;
        return name.replace('_', ' ');
    }

    private void recordFailure(IngestionReport.Accumulator accumulator, int batchIndex,
                               List<String> ids, CitedSearchException e) {
        log.error("Batch {} failed for {} chunks: {}", batchIndex, ids.size(), e.getMessage());
        accumulator.addFailure(new FailedBatch(batchIndex, ids, e.getMessage()));
    }

    private static List<String> recordIds(List<VectorRecord> records) {
        return records.stream().map(VectorRecord::id).toList();
    }

    static List<List<Chunk>> partition(List<Chunk> chunks, int batchSize) {
        List<List<Chunk>> batches = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += batchSize) {
            batches.add(List.copyOf(chunks.subList(start, Math.min(start + batchSize, chunks.size()))));
        }
        return batches;
    }
}
