package com.adlanda.citedsearch.model;

/**
 * A reference from generated text to a page of a source document.
 *
 * Identity is the (filename, page) pair.
 *
 * @param filename  Source document filename as written in the marker
 * @param page      1-based page number
 */
public record Citation(String filename, int page) {

    public Citation {
        if (page < 1) {
            throw new IllegalArgumentException("Citation page must be >= 1 but was " + page);
        }
    }
}
