package com.adlanda.citedsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the vector index and hybrid search.
 *
 * Maps to properties prefixed with 'citedsearch.retrieval' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "citedsearch.retrieval")
public class RetrievalProperties {

    public enum IndexType { MEMORY, PGVECTOR }

    private int defaultTopK = 5;

    /**
     * Upper bound accepted for topK.
     */
    private int maxTopK = 20;

    /**
     * Blend weight used when a query does not set one. 0 = keyword, 1 = semantic.
     */
    private double defaultAlpha = 0.5;

    private Duration embeddingTimeout = Duration.ofSeconds(30);

    private Duration indexTimeout = Duration.ofSeconds(10);

    private IndexType indexType = IndexType.MEMORY;

    /**
     * Embedding dimension, fixed by the embedding model (text-embedding-3-large = 3072).
     */
    private int dimensions = 3072;

    /**
     * Largest upsert request the in-memory index accepts. 0 = unlimited.
     */
    private int maxRecordsPerUpsert = 0;

    /**
     * Create the pgvector table and extension on startup.
     */
    private boolean initializeSchema = true;

    private final Tokenizer tokenizer = new Tokenizer();

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public void setMaxTopK(int maxTopK) {
        this.maxTopK = maxTopK;
    }

    public double getDefaultAlpha() {
        return defaultAlpha;
    }

    public void setDefaultAlpha(double defaultAlpha) {
        this.defaultAlpha = defaultAlpha;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public void setEmbeddingTimeout(Duration embeddingTimeout) {
        this.embeddingTimeout = embeddingTimeout;
    }

    public Duration getIndexTimeout() {
        return indexTimeout;
    }

    public void setIndexTimeout(Duration indexTimeout) {
        this.indexTimeout = indexTimeout;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    public void setIndexType(IndexType indexType) {
        this.indexType = indexType;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getMaxRecordsPerUpsert() {
        return maxRecordsPerUpsert;
    }

    public void setMaxRecordsPerUpsert(int maxRecordsPerUpsert) {
        this.maxRecordsPerUpsert = maxRecordsPerUpsert;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    /**
     * Settings of the hashing tokenizer behind the sparse vectors.
     * Changing either value invalidates every sparse vector already indexed.
     */
    public static class Tokenizer {

        /**
         * Size of the token id space, reserved ids included.
         */
        private int vocabularySize = 250002;

        /**
         * Words longer than this are split into sub-word pieces.
         */
        private int maxPieceLength = 12;

        public int getVocabularySize() {
            return vocabularySize;
        }

        public void setVocabularySize(int vocabularySize) {
            this.vocabularySize = vocabularySize;
        }

        public int getMaxPieceLength() {
            return maxPieceLength;
        }

        public void setMaxPieceLength(int maxPieceLength) {
            this.maxPieceLength = maxPieceLength;
        }
    }
}
