package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.model.IngestionReport;
import com.adlanda.citedsearch.service.CorpusIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for triggering ingestion of the chunks directory.
 */
@RestController
@RequestMapping("/api/v1")
public class IngestionController {

    private final CorpusIngestionService corpusIngestionService;

    public IngestionController(CorpusIngestionService corpusIngestionService) {
        this.corpusIngestionService = corpusIngestionService;
    }

    /**
     * Runs an ingestion pass and returns its report. Chunks already in the index are skipped.
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionReport> ingest() {
        return ResponseEntity.ok(corpusIngestionService.ingestConfiguredDirectory());
    }
}
