package com.adlanda.citedsearch.service.generation;

import reactor.core.publisher.Flux;

/**
 * Streams text from a generative model.
 */
public interface GenerationClient {

    /**
     * Starts generation lazily on subscription. The returned stream is finite and cannot be
     * restarted; cancelling the subscription cancels the upstream request.
     *
     * @param prompt Complete prompt text
     * @return Text deltas in generation order
     */
    Flux<String> generate(String prompt);
}
