package com.adlanda.citedsearch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of one ingestion run.
 *
 * @param processed      Chunks embedded and upserted in this run
 * @param skipped        Chunks whose id was already present in the index
 * @param empty          Chunks dropped because their text was empty after normalization
 * @param excluded       Chunks dropped because their element type is excluded (images, page numbers, ...)
 * @param failedBatches  Batches that could not be written after exhausting retries
 * @param elapsedSeconds Wall-clock duration of the run
 */
public record IngestionReport(
        int processed,
        int skipped,
        int empty,
        int excluded,
        List<FailedBatch> failedBatches,
        double elapsedSeconds
) {
    public IngestionReport {
        failedBatches = failedBatches != null ? List.copyOf(failedBatches) : List.of();
    }

    public static IngestionReport emptyRun() {
        return new IngestionReport(0, 0, 0, 0, List.of(), 0.0);
    }

    public int failedBatchCount() {
        return failedBatches.size();
    }

    /**
     * Ids of every chunk that belongs to a failed batch, in batch order.
     */
    @JsonIgnore
    public List<String> failedChunkIds() {
        return failedBatches.stream()
                .flatMap(batch -> batch.chunkIds().stream())
                .toList();
    }

    public boolean hasFailures() {
        return !failedBatches.isEmpty();
    }

    /**
     * A batch (or the unwritten remainder of one) that was given up on.
     *
     * @param batchIndex  0-based position of the batch in the run
     * @param chunkIds    Ids that were not written
     * @param reason      Last error message
     */
    public record FailedBatch(int batchIndex, List<String> chunkIds, String reason) {
        public FailedBatch {
            chunkIds = List.copyOf(chunkIds);
        }
    }

    /**
     * Single accumulation point for batches processed concurrently.
     */
    public static final class Accumulator {

        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger empty = new AtomicInteger();
        private final AtomicInteger excluded = new AtomicInteger();
        private final ConcurrentLinkedQueue<FailedBatch> failedBatches = new ConcurrentLinkedQueue<>();

        public void addProcessed(int count) {
            processed.addAndGet(count);
        }

        public void addSkipped(int count) {
            skipped.addAndGet(count);
        }

        public void addEmpty(int count) {
            empty.addAndGet(count);
        }

        public void addExcluded(int count) {
            excluded.addAndGet(count);
        }

        public void addFailure(FailedBatch failedBatch) {
            failedBatches.add(failedBatch);
        }

        public IngestionReport toReport(double elapsedSeconds) {
            List<FailedBatch> failures = new ArrayList<>(failedBatches);
            failures.sort((a, b) -> Integer.compare(a.batchIndex(), b.batchIndex()));
            return new IngestionReport(
                    processed.get(),
                    skipped.get(),
                    empty.get(),
                    excluded.get(),
                    failures,
                    elapsedSeconds
            );
        }
    }
}
