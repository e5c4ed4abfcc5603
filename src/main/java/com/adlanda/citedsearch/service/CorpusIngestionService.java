package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.IngestionProperties;
import com.adlanda.citedsearch.exception.IngestionInProgressException;
import com.adlanda.citedsearch.health.IngestionHealthIndicator;
import com.adlanda.citedsearch.model.Chunk;
import com.adlanda.citedsearch.model.IngestionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a full ingestion pass over the chunks directory: load the chunk files, refresh the
 * document catalog, write the chunks to the index and persist the report.
 *
 * Only one pass runs at a time.
 */
@Service
public class CorpusIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CorpusIngestionService.class);

    private final ChunkFileLoader chunkFileLoader;
    private final DocumentCatalog documentCatalog;
    private final IngestionService ingestionService;
    private final IngestionReportWriter reportWriter;
    private final IngestionHealthIndicator healthIndicator;
    private final IngestionProperties ingestionProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public CorpusIngestionService(ChunkFileLoader chunkFileLoader,
                                  DocumentCatalog documentCatalog,
                                  IngestionService ingestionService,
                                  IngestionReportWriter reportWriter,
                                  IngestionHealthIndicator healthIndicator,
                                  IngestionProperties ingestionProperties) {
        this.chunkFileLoader = chunkFileLoader;
        this.documentCatalog = documentCatalog;
        this.ingestionService = ingestionService;
        this.reportWriter = reportWriter;
        this.healthIndicator = healthIndicator;
        this.ingestionProperties = ingestionProperties;
    }

    public IngestionReport ingestConfiguredDirectory() {
        return ingestDirectory(Path.of(ingestionProperties.getChunksPath()));
    }

    /**
     * @throws IngestionInProgressException if another pass is running
     */
    public IngestionReport ingestDirectory(Path directory) {
        if (!running.compareAndSet(false, true)) {
            throw new IngestionInProgressException("An ingestion run is already in progress");
        }
        try {
            List<Chunk> chunks = chunkFileLoader.loadDirectory(directory);
            documentCatalog.rebuild(chunks);

            if (chunks.isEmpty()) {
                log.warn("No chunks found to ingest in {}", directory);
            }
            IngestionReport report = chunks.isEmpty() ? IngestionReport.emptyRun() : ingestionService.ingest(chunks);

            try {
                reportWriter.write(report);
            } catch (UncheckedIOException e) {
                log.warn("Ingestion report not persisted: {}", e.getMessage());
            }
            healthIndicator.markCompleted(report);
            return report;
        } catch (RuntimeException e) {
            healthIndicator.markFailed(e.getMessage());
            throw e;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
