package com.adlanda.citedsearch.health;

import com.adlanda.citedsearch.model.IngestionReport;
import com.adlanda.citedsearch.model.IngestionReport.FailedBatch;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionHealthIndicatorTest {

    private final IngestionHealthIndicator indicator = new IngestionHealthIndicator();

    @Test
    void health_beforeFirstRun_isDown() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Ingestion not yet run");
    }

    @Test
    void health_afterCompletedRunWithFailedBatch_isUpWithCounts() {
        indicator.markCompleted(new IngestionReport(10, 2, 1, 3,
                List.of(new FailedBatch(1, List.of("c7"), "timeout")), 4.0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("chunksProcessed", 10)
                .containsEntry("chunksSkipped", 2)
                .containsEntry("chunksEmpty", 1)
                .containsEntry("chunksExcluded", 3)
                .containsEntry("failedBatches", 1)
                .containsKey("lastRun");
    }

    @Test
    void health_afterAbortedRun_isDownWithError() {
        indicator.markCompleted(IngestionReport.emptyRun());
        indicator.markFailed("index unreachable");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "index unreachable");
    }
}
