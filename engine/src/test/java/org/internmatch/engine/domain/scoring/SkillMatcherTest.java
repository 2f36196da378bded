package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SkillMatcherTest {

    private final SkillMatcher matcher = new SkillMatcher();

    private double score(java.util.List<String> candidateSkills, java.util.List<String> required) {
        Candidate candidate = Fixtures.candidate().skills(candidateSkills).build();
        Internship internship = Fixtures.internship("i-1").skillsRequired(required).build();
        return matcher.score(candidate, internship);
    }

    @Test
    @DisplayName("identical normalized skill sets score 1.0")
    void identicalSets() {
        assertThat(score(Arrays.asList("Python", " SQL"), Arrays.asList("sql", "PYTHON"))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("no required skills is a vacuous match")
    void emptyRequirement() {
        assertThat(score(Collections.emptyList(), Collections.emptyList())).isEqualTo(1.0);
        assertThat(score(Arrays.asList("python"), Collections.emptyList())).isEqualTo(1.0);
    }

    @Test
    @DisplayName("python+javascript against python+react scores 0.5")
    void halfMatch() {
        assertThat(score(Arrays.asList("python", "javascript"), Arrays.asList("python", "react"))).isEqualTo(0.5);
    }

    @Test
    @DisplayName("a near-miss spelling earns partial credit")
    void fuzzyPartialCredit() {
        assertThat(score(Arrays.asList("javascrpt"), Arrays.asList("javascript"))).isEqualTo(0.5);
    }

    @Test
    @DisplayName("similarity exactly at the threshold earns nothing")
    void thresholdIsExclusive() {
        // containment ratio 8/10 = 0.8, not above the default threshold
        assertThat(score(Arrays.asList("postgres"), Arrays.asList("postgresql"))).isZero();
    }

    @Test
    @DisplayName("candidate without skills scores 0 against requirements")
    void noCandidateSkills() {
        assertThat(score(Collections.emptyList(), Arrays.asList("python"))).isZero();
    }

    @Test
    @DisplayName("mean is taken over required skills")
    void meanOverRequired() {
        double score = score(Arrays.asList("python", "sql", "excel"),
                Arrays.asList("python", "sql", "statistics"));

        assertThat(score).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("threshold and credit are configurable")
    void configurable() {
        SkillMatcher lenient = new SkillMatcher(0.7, 0.25);
        Candidate candidate = Fixtures.candidate().skills(Arrays.asList("postgres")).build();
        Internship internship = Fixtures.internship("i-1").skillsRequired(Arrays.asList("postgresql")).build();

        assertThat(lenient.score(candidate, internship)).isEqualTo(0.25);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new SkillMatcher(0.0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SkillMatcher(0.8, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
