package com.adlanda.citedsearch.model;

import java.util.List;

/**
 * A generated answer with the page citations it contains.
 *
 * @param answer               Generated text; partial when {@code complete} is false
 * @param citations            Citations that point at one of the retrieved sources, in order of first appearance
 * @param unverifiedCitations  Well-formed citations naming a document that was not retrieved
 * @param sources              The search results the answer was grounded on
 * @param complete             False when the generation stream failed or timed out
 * @param error                Failure message when {@code complete} is false
 * @param generationTimeMs     Time spent streaming from the generation model
 */
public record AnswerResponse(
        String answer,
        List<Citation> citations,
        List<Citation> unverifiedCitations,
        List<SearchResult> sources,
        boolean complete,
        String error,
        long generationTimeMs
) {}
