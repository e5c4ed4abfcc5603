package com.adlanda.citedsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cited Search - Main Application
 *
 * Answers questions over a corpus of product manuals with passages and page citations
 * that point back to the exact document and page.
 *
 * This application uses:
 * - Spring Boot 3.4 on Java 17
 * - Spring AI for embeddings and streamed chat completions via OpenAI
 * - An in-memory hybrid (dense + BM25 sparse) index, or PGVector with full-text ranking
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class CitedSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitedSearchApplication.class, args);
    }
}
