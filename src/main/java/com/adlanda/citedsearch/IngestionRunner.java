package com.adlanda.citedsearch;

import com.adlanda.citedsearch.config.IngestionProperties;
import com.adlanda.citedsearch.model.IngestionReport;
import com.adlanda.citedsearch.service.CorpusIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs chunk ingestion on application startup.
 *
 * Reads the chunk files from the configured directory and writes every chunk that is not
 * already indexed. Disabled with {@code citedsearch.ingestion.enabled=false}.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final CorpusIngestionService corpusIngestionService;
    private final IngestionProperties ingestionProperties;

    public IngestionRunner(CorpusIngestionService corpusIngestionService, IngestionProperties ingestionProperties) {
        this.corpusIngestionService = corpusIngestionService;
        this.ingestionProperties = ingestionProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!ingestionProperties.isEnabled()) {
            log.info("Startup ingestion disabled");
            return;
        }

        log.info("Starting chunk ingestion from {}...", ingestionProperties.getChunksPath());

        try {
            IngestionReport report = corpusIngestionService.ingestConfiguredDirectory();
            if (report.hasFailures()) {
                log.warn("Ingestion finished with {} failed batches ({} chunks not indexed)",
                        report.failedBatchCount(), report.failedChunkIds().size());
            }
        } catch (Exception e) {
            log.error("Failed to ingest chunks: {}", e.getMessage(), e);
        }
    }
}
