package com.adlanda.citedsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for chunk ingestion.
 *
 * Maps to properties prefixed with 'citedsearch.ingestion' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "citedsearch.ingestion")
public class IngestionProperties {

    /**
     * Whether ingestion runs at startup.
     * When false, chunks are only ingested through the API (useful for testing).
     */
    private boolean enabled = true;

    /**
     * Directory holding the partitioner's chunk JSON files.
     */
    private String chunksPath = "./chunks";

    /**
     * Number of chunks per embedding call and per upsert request.
     */
    private int batchSize = 50;

    /**
     * Number of batches processed concurrently. 1 means strictly sequential.
     */
    private int parallelism = 1;

    /**
     * Attempts per upsert request before the batch is recorded as failed.
     */
    private int maxRetries = 3;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private Duration maxBackoff = Duration.ofSeconds(8);

    /**
     * Element types that are never indexed.
     */
    private List<String> excludedTypes = new ArrayList<>(List.of("Image", "PageNumber", "Footer"));

    /**
     * Prefix the embedded text with the document name so that queries naming a
     * product manual match its chunks. The stored text is left unchanged.
     */
    private boolean filenamePrefix = true;

    /**
     * Replace German umlauts and sharp s with their ASCII spellings before indexing.
     */
    private boolean transliterateUmlauts = false;

    /**
     * Where the JSON report of the last run is written. Empty disables the report file.
     */
    private String reportPath = "./ingestion-report.json";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getChunksPath() {
        return chunksPath;
    }

    public void setChunksPath(String chunksPath) {
        this.chunksPath = chunksPath;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public List<String> getExcludedTypes() {
        return excludedTypes;
    }

    public void setExcludedTypes(List<String> excludedTypes) {
        this.excludedTypes = excludedTypes;
    }

    public boolean isFilenamePrefix() {
        return filenamePrefix;
    }

    public void setFilenamePrefix(boolean filenamePrefix) {
        this.filenamePrefix = filenamePrefix;
    }

    public boolean isTransliterateUmlauts() {
        return transliterateUmlauts;
    }

    public void setTransliterateUmlauts(boolean transliterateUmlauts) {
        this.transliterateUmlauts = transliterateUmlauts;
    }

    public String getReportPath() {
        return reportPath;
    }

    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }
}
