package com.adlanda.citedsearch.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchResultTest {

    @Test
    void coercePage_numbersAreTruncatedToInt() {
        assertThat(SearchResult.coercePage(3)).isEqualTo(3);
        assertThat(SearchResult.coercePage(3.0)).isEqualTo(3);
        assertThat(SearchResult.coercePage(7.9f)).isEqualTo(7);
        assertThat(SearchResult.coercePage(12L)).isEqualTo(12);
    }

    @Test
    void coercePage_numericStringsAreParsed() {
        assertThat(SearchResult.coercePage("5")).isEqualTo(5);
        assertThat(SearchResult.coercePage(" 5.0 ")).isEqualTo(5);
    }

    @Test
    void coercePage_missingOrInvalidValues_defaultToFirstPage() {
        assertThat(SearchResult.coercePage(null)).isEqualTo(1);
        assertThat(SearchResult.coercePage("n/a")).isEqualTo(1);
        assertThat(SearchResult.coercePage(0)).isEqualTo(1);
        assertThat(SearchResult.coercePage(-4.0)).isEqualTo(1);
        assertThat(SearchResult.coercePage(Double.NaN)).isEqualTo(1);
    }
}
