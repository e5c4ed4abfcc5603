package com.adlanda.citedsearch.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Cited Search",
                "version", appVersion,
                "endpoints", Map.of(
                        "search", "POST /api/v1/search - Hybrid search over indexed documents",
                        "answer", "POST /api/v1/answer - Answer a question with page citations",
                        "answerStream", "POST /api/v1/answer/stream - Stream an answer as server-sent events",
                        "ingest", "POST /api/v1/ingest - Ingest the configured chunks directory",
                        "sources", "GET /api/v1/sources - List indexed documents",
                        "categories", "GET /api/v1/sources/categories - List product categories",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
