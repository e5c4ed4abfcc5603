package com.adlanda.citedsearch.service.citation;

import com.adlanda.citedsearch.model.Citation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CitationExtractorTest {

    private final CitationExtractor extractor = new CitationExtractor();

    @Test
    void extract_englishAndGermanMarkers_returnsCitationsInOrder() {
        List<Citation> citations = extractor.extract(
                "Set it to 50 mbar [manual.pdf, Page 3]. Siehe auch [handbuch.pdf, Seite 12].");

        assertThat(citations).containsExactly(
                new Citation("manual.pdf", 3),
                new Citation("handbuch.pdf", 12));
    }

    @Test
    void extract_sameMarkerTwice_returnsSingleCitation() {
        assertThat(extractor.extract("See [manual.pdf, Page 5] and again [manual.pdf, Page 5]."))
                .containsExactly(new Citation("manual.pdf", 5));
    }

    @Test
    void extract_germanMarker_returnsCitation() {
        assertThat(extractor.extract("Siehe [handbuch.pdf, Seite 12]."))
                .containsExactly(new Citation("handbuch.pdf", 12));
    }

    @Test
    void extract_repeatedCitation_isReturnedOnce() {
        List<Citation> citations = extractor.extract(
                "[manual.pdf, Page 3] first, [handbuch.pdf, Seite 1] then [manual.pdf, Page 3] again");

        assertThat(citations).containsExactly(
                new Citation("manual.pdf", 3),
                new Citation("handbuch.pdf", 1));
    }

    @Test
    void extract_filenameWithSpaces_isTrimmed() {
        assertThat(extractor.extract("see [  DMV D Manual.pdf ,  Page 7 ]"))
                .isEmpty();
        assertThat(extractor.extract("see [  DMV D Manual.pdf ,  Page 7]"))
                .containsExactly(new Citation("DMV D Manual.pdf", 7));
    }

    @Test
    void extract_malformedMarkers_areIgnored() {
        assertThat(extractor.extract("[manual.pdf, page 3]")).isEmpty();
        assertThat(extractor.extract("[manual.pdf, Page 0]")).isEmpty();
        assertThat(extractor.extract("[manual.pdf, Page -2]")).isEmpty();
        assertThat(extractor.extract("[manual.pdf, Page three]")).isEmpty();
        assertThat(extractor.extract("[manual.pdf Page 3]")).isEmpty();
        assertThat(extractor.extract("[, Page 3]")).isEmpty();
        assertThat(extractor.extract("[1] and [2]")).isEmpty();
    }

    @Test
    void extract_partialMarkerAtEndOfStream_isIgnoredUntilClosed() {
        assertThat(extractor.extract("Use 50 mbar [manual.pdf, Pa")).isEmpty();
        assertThat(extractor.extract("Use 50 mbar [manual.pdf, Page 3")).isEmpty();
        assertThat(extractor.extract("Use 50 mbar [manual.pdf, Page 3]"))
                .containsExactly(new Citation("manual.pdf", 3));
    }

    @Test
    void extract_nullOrEmpty_returnsEmptyList() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
    }
}
