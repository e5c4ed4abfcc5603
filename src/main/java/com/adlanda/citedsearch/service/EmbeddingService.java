package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.EmbeddingException;
import com.adlanda.citedsearch.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for generating dense vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel to call OpenAI's embedding API. A batch of texts is
 * always sent as a single request.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private static final String COLLABORATOR = "embedding";

    private final EmbeddingModel embeddingModel;
    private final TimeLimitedCalls timeLimitedCalls;
    private final Duration timeout;

    public EmbeddingService(EmbeddingModel embeddingModel,
                            TimeLimitedCalls timeLimitedCalls,
                            RetrievalProperties retrievalProperties) {
        this.embeddingModel = embeddingModel;
        this.timeLimitedCalls = timeLimitedCalls;
        this.timeout = retrievalProperties.getEmbeddingTimeout();
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed
     * @return The embedding vector (3072 dimensions for text-embedding-3-large)
     */
    public List<Double> embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds all texts with one bulk request.
     *
     * @param texts Texts to embed
     * @return One vector per input, in input order
     * @throws EmbeddingException           when the model fails or answers with the wrong shape
     * @throws CollaboratorTimeoutException when the request exceeds the embedding timeout
     */
    public List<List<Double>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        EmbeddingResponse response;
        try {
            response = timeLimitedCalls.call(COLLABORATOR, timeout,
                    () -> embeddingModel.embedForResponse(texts));
        } catch (CollaboratorTimeoutException | OperationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request for " + texts.size() + " texts failed: "
                    + e.getMessage(), e);
        }

        if (response == null || response.getResults() == null || response.getResults().size() != texts.size()) {
            int received = response == null || response.getResults() == null ? 0 : response.getResults().size();
            throw new EmbeddingException("Expected " + texts.size() + " embeddings but received " + received);
        }

        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            vectors.add(null);
        }
        List<Embedding> results = response.getResults();
        for (int i = 0; i < results.size(); i++) {
            Embedding embedding = results.get(i);
            int position = embedding.getIndex() != null ? embedding.getIndex() : i;
            if (position < 0 || position >= texts.size() || vectors.get(position) != null) {
                throw new EmbeddingException("Embedding response has an invalid index " + position);
            }
            float[] output = embedding.getOutput();
            if (output == null || output.length == 0) {
                throw new EmbeddingException("Embedding response contains an empty vector at index " + position);
            }
            vectors.set(position, toDoubleList(output));
        }

        log.debug("Generated {} embeddings", vectors.size());
        return vectors;
    }

    private List<Double> toDoubleList(float[] floats) {
        Double[] doubles = new Double[floats.length];
        for (int i = 0; i < floats.length; i++) {
            doubles[i] = (double) floats[i];
        }
        return List.of(doubles);
    }
}
