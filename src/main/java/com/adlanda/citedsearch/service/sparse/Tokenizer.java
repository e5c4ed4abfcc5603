package com.adlanda.citedsearch.service.sparse;

import java.util.List;

/**
 * Turns text into token ids for lexical weighting.
 *
 * Implementations must be deterministic: the same text always yields the same ids,
 * across calls and across JVM restarts, because ids are persisted in the index.
 */
public interface Tokenizer {

    /**
     * @param text Text to tokenize; null or blank yields an empty list
     * @return Token ids in text order, duplicates preserved
     */
    List<Integer> encode(String text);
}
