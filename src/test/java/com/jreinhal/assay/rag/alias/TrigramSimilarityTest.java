package com.jreinhal.assay.rag.alias;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TrigramSimilarityTest {

    @Test
    void identicalStringsScoreOne() {
        assertThat(TrigramSimilarity.score("bisgma", "bisgma")).isEqualTo(1.0);
    }

    @Test
    void scoreIsSymmetric() {
        assertThat(TrigramSimilarity.score("bis-gma", "bisgma"))
                .isEqualTo(TrigramSimilarity.score("bisgma", "bis-gma"));
    }

    @Test
    void spellingVariantsScoreHigherThanUnrelatedTerms() {
        assertThat(TrigramSimilarity.score("bis-gma", "bisgma")).isGreaterThan(0.4);
        assertThat(TrigramSimilarity.score("tegdma", "vitality")).isLessThan(0.3);
    }

    @Test
    void shortOrMissingInputScoresZero() {
        assertThat(TrigramSimilarity.score("ab", "abc")).isZero();
        assertThat(TrigramSimilarity.score(null, "abc")).isZero();
    }
}
