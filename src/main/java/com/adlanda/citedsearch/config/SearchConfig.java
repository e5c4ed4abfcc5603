package com.adlanda.citedsearch.config;

import com.adlanda.citedsearch.service.ChunkTextNormalizer;
import com.adlanda.citedsearch.service.sparse.HashingTokenizer;
import com.adlanda.citedsearch.service.sparse.Tokenizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Text processing beans shared by ingestion and search.
 */
@Configuration
public class SearchConfig {

    @Bean
    public Tokenizer tokenizer(RetrievalProperties retrievalProperties) {
        RetrievalProperties.Tokenizer settings = retrievalProperties.getTokenizer();
        return new HashingTokenizer(settings.getVocabularySize(), settings.getMaxPieceLength());
    }

    @Bean
    public ChunkTextNormalizer chunkTextNormalizer(IngestionProperties ingestionProperties) {
        return new ChunkTextNormalizer(ingestionProperties.isTransliterateUmlauts());
    }
}
