package com.adlanda.citedsearch.model;

import java.util.List;

/**
 * One event of a streamed answer.
 *
 * stage   - "sources", "delta", "done" or "error"
 * payload - the retrieved {@link SearchResult} list, a text delta, or the final {@link AnswerResponse}
 */
public record AnswerEvent(
        String stage,
        Object payload
) {
    public static final String SOURCES = "sources";
    public static final String DELTA = "delta";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static AnswerEvent sources(List<SearchResult> results) {
        return new AnswerEvent(SOURCES, results);
    }

    public static AnswerEvent delta(String text) {
        return new AnswerEvent(DELTA, text);
    }

    public static AnswerEvent done(AnswerResponse response) {
        return new AnswerEvent(DONE, response);
    }

    public static AnswerEvent error(AnswerResponse partial) {
        return new AnswerEvent(ERROR, partial);
    }
}
