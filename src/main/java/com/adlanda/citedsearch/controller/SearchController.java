package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.model.SearchQuery;
import com.adlanda.citedsearch.model.SearchResponse;
import com.adlanda.citedsearch.model.SourcesResponse;
import com.adlanda.citedsearch.service.DocumentCatalog;
import com.adlanda.citedsearch.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for searching the document index.
 */
@RestController
@RequestMapping("/api/v1")
public class SearchController {

    private final RetrievalService retrievalService;
    private final DocumentCatalog documentCatalog;

    public SearchController(RetrievalService retrievalService, DocumentCatalog documentCatalog) {
        this.retrievalService = retrievalService;
        this.documentCatalog = documentCatalog;
    }

    /**
     * Hybrid search for passages relevant to a query.
     *
     * @param query The query text with optional topK, file/category filters and alpha
     * @return SearchResponse with ranked passages and timing
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchQuery query) {
        return ResponseEntity.ok(retrievalService.search(query));
    }

    /**
     * Indexed documents with their product metadata.
     */
    @GetMapping("/sources")
    public ResponseEntity<SourcesResponse> getSources() {
        return ResponseEntity.ok(new SourcesResponse(retrievalService.getIndexSize(), documentCatalog.documents()));
    }

    @GetMapping("/sources/categories")
    public ResponseEntity<List<String>> getCategories() {
        return ResponseEntity.ok(documentCatalog.categories());
    }
}
