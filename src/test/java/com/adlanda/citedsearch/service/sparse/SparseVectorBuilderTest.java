package com.adlanda.citedsearch.service.sparse;

import com.adlanda.citedsearch.model.SparseVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SparseVectorBuilderTest {

    /**
     * Treats the text as whitespace-separated token ids so weights can be checked by hand.
     */
    private static final Tokenizer ID_TOKENIZER = text -> text.isBlank()
            ? List.of()
            : Arrays.stream(text.trim().split("\\s+")).map(Integer::valueOf).toList();

    private SparseVectorBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SparseVectorBuilder(ID_TOKENIZER);
    }

    @Test
    void build_singleDocument_returnsSubsetOfItsTokens() {
        List<SparseVector> vectors = builder.build(List.of("5 6 7 5"));

        assertThat(vectors).hasSize(1);
        assertThat(vectors.get(0).tokenIds()).isSubsetOf(5, 6, 7);
    }

    @Test
    void build_termUniqueToOneDocument_getsBm25Weight() {
        List<SparseVector> vectors = builder.build(List.of("5 6", "7 8", "9 10"));

        // N=3, df=1, tf=1, len == avgLen
        double idf = Math.log((3 - 1 + 0.5) / (1 + 0.5));
        double expected = idf * (1 * (SparseVectorBuilder.K1 + 1)) / (1 + SparseVectorBuilder.K1);
        assertThat(vectors.get(0).weight(5)).isCloseTo(expected, within(1e-9));
        assertThat(vectors.get(2).weight(10)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void build_longerDocument_getsLowerWeightForSameTerm() {
        List<SparseVector> vectors = builder.build(List.of("5", "5 6 7 8 9", "11", "12", "13"));

        assertThat(vectors.get(0).weight(5)).isGreaterThan(vectors.get(1).weight(5));
    }

    @Test
    void build_termInEveryDocument_isOmitted() {
        List<SparseVector> vectors = builder.build(List.of("5 6", "5 7", "5 8"));

        assertThat(vectors).allSatisfy(vector -> assertThat(vector.tokenIds()).doesNotContain(5));
        assertThat(vectors.get(0).tokenIds()).containsExactly(6);
    }

    @Test
    void build_specialTokens_areNeverWeighted() {
        List<SparseVector> vectors = builder.build(List.of("0 1 2 5", "6", "7"));

        assertThat(vectors.get(0).tokenIds()).containsExactly(5);
    }

    @Test
    void build_onlySpecialTokens_returnsEmptyVector() {
        List<SparseVector> vectors = builder.build(List.of("0 1 2", "6", "7"));

        assertThat(vectors.get(0).isEmpty()).isTrue();
    }

    @Test
    void build_allDocumentsEmpty_returnsEmptyVectorsWithoutFailing() {
        List<SparseVector> vectors = builder.build(List.of("", " ", ""));

        assertThat(vectors).hasSize(3).allSatisfy(vector -> assertThat(vector.isEmpty()).isTrue());
    }

    @Test
    void build_emptyDocumentInBatch_getsEmptyVector() {
        List<SparseVector> vectors = builder.build(List.of("5 6", "", "7 8"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors.get(1).isEmpty()).isTrue();
        assertThat(vectors.get(0).isEmpty()).isFalse();
    }

    @Test
    void build_emptyInput_returnsEmptyList() {
        assertThat(builder.build(List.of())).isEmpty();
    }

    @Test
    void buildQuery_assignsUnitWeightPerDistinctToken() {
        SparseVector query = builder.buildQuery("5 6 5 1");

        assertThat(query.tokenIds()).containsExactlyInAnyOrder(5, 6);
        assertThat(query.weight(5)).isEqualTo(1.0);
        assertThat(query.weight(6)).isEqualTo(1.0);
    }

    @Test
    void buildQuery_dotWithDocumentVector_sumsMatchingTermWeights() {
        List<SparseVector> documents = builder.build(List.of("5 6", "7 8", "9 10"));

        double score = builder.buildQuery("5 9").dot(documents.get(0));

        assertThat(score).isCloseTo(documents.get(0).weight(5), within(1e-9));
    }

    @Test
    void build_withHashingTokenizer_weightsRealText() {
        SparseVectorBuilder textBuilder = new SparseVectorBuilder(new HashingTokenizer(250002, 12));

        List<SparseVector> vectors = textBuilder.build(List.of(
                "Gas valve pressure setting",
                "Burner control wiring diagram",
                "Replace the valve seal"));

        assertThat(vectors).hasSize(3).allSatisfy(vector -> assertThat(vector.isEmpty()).isFalse());
    }
}
