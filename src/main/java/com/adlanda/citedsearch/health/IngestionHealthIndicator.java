package com.adlanda.citedsearch.health;

import com.adlanda.citedsearch.model.IngestionReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the chunk ingestion process.
 *
 * Reports the status of the last ingestion run, including:
 * - Whether the run completed and whether any batch failed
 * - Processed, skipped, empty and excluded chunk counts
 * - Timestamp of last run
 * - Error details if the run aborted
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(false, null, "Ingestion not yet run", null)
    );

    /**
     * Records a completed run. Failed batches are reported as details; the service stays up
     * because every successfully written chunk remains searchable.
     */
    public void markCompleted(IngestionReport report) {
        state.set(new HealthState(true, report, null, Instant.now()));
    }

    /**
     * Records a run that aborted with the given error message.
     */
    public void markFailed(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.report() != null) {
                builder.withDetail("chunksProcessed", current.report().processed())
                       .withDetail("chunksSkipped", current.report().skipped())
                       .withDetail("chunksEmpty", current.report().empty())
                       .withDetail("chunksExcluded", current.report().excluded())
                       .withDetail("failedBatches", current.report().failedBatchCount())
                       .withDetail("elapsedSeconds", current.report().elapsedSeconds());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record HealthState(
            boolean healthy,
            IngestionReport report,
            String error,
            Instant timestamp
    ) {}
}
