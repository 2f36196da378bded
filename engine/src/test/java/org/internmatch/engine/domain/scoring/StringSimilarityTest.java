package org.internmatch.engine.domain.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StringSimilarityTest {

    @Test
    void equalAfterNormalizationIsOne() {
        assertThat(StringSimilarity.similarity(" Python ", "python")).isEqualTo(1.0);
    }

    @Test
    void blankIsZero() {
        assertThat(StringSimilarity.similarity("", "python")).isZero();
        assertThat(StringSimilarity.similarity(null, "python")).isZero();
    }

    @Test
    void levenshteinDistance() {
        assertThat(StringSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("abc", "abc")).isZero();
    }

    @Test
    void singleTypoScoresHigh() {
        // one deletion over ten characters
        assertThat(StringSimilarity.similarity("javascript", "javascrpt")).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void containmentUsesLengthRatio() {
        assertThat(StringSimilarity.containmentRatio("postgres", "postgresql")).isCloseTo(0.8, within(1e-9));
        assertThat(StringSimilarity.containmentRatio("java", "python")).isZero();
    }

    @Test
    void unrelatedSkillsScoreLow() {
        assertThat(StringSimilarity.similarity("react", "javascript")).isLessThan(0.5);
        assertThat(StringSimilarity.similarity("java", "javascript")).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void isSymmetric() {
        assertThat(StringSimilarity.similarity("tensorflow", "tensor flow"))
                .isEqualTo(StringSimilarity.similarity("tensor flow", "tensorflow"));
    }
}
