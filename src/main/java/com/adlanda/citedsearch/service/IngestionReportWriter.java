package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.IngestionProperties;
import com.adlanda.citedsearch.model.IngestionReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the summary of an ingestion run as JSON.
 */
@Service
public class IngestionReportWriter {

    private static final Logger log = LoggerFactory.getLogger(IngestionReportWriter.class);

    private final ObjectMapper objectMapper;
    private final IngestionProperties ingestionProperties;

    public IngestionReportWriter(ObjectMapper objectMapper, IngestionProperties ingestionProperties) {
        this.objectMapper = objectMapper;
        this.ingestionProperties = ingestionProperties;
    }

    /**
     * Writes the report to the configured path, replacing any previous report.
     *
     * @return The path written to
     */
    public Path write(IngestionReport report) {
        Path path = Path.of(ingestionProperties.getReportPath());
        PersistedReport persisted = new PersistedReport(
                report.processed(),
                report.skipped(),
                report.failedBatchCount(),
                report.elapsedSeconds(),
                report.empty(),
                report.excluded(),
                report.failedBatches()
        );
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), persisted);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ingestion report to " + path, e);
        }
        log.info("Ingestion report written to {}", path);
        return path;
    }

    public record PersistedReport(
            int processedCount,
            int skippedCount,
            int failedBatchCount,
            double elapsedSeconds,
            int emptyCount,
            int excludedCount,
            List<IngestionReport.FailedBatch> failedBatches
    ) {}
}
