package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;
import org.internmatch.engine.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateTest {

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("should trim, lower-case and de-duplicate skills")
        void normalizesSkills() {
            Candidate candidate = Fixtures.candidate()
                    .skills(Arrays.asList("  Python ", "PYTHON", "Machine   Learning", "", null))
                    .build();

            assertThat(candidate.getSkills()).containsExactly("python", "machine learning");
        }

        @Test
        @DisplayName("should normalize sector interests")
        void normalizesSectors() {
            Candidate candidate = Fixtures.candidate()
                    .sectorInterests(Arrays.asList("Technology ", "Data Science"))
                    .build();

            assertThat(candidate.getSectorInterests()).containsExactly("technology", "data science");
        }

        @Test
        @DisplayName("should treat missing skills as an empty set")
        void missingSkillsAreEmpty() {
            Candidate candidate = Fixtures.candidate().skills(null).sectorInterests(null).build();

            assertThat(candidate.getSkills()).isEmpty();
            assertThat(candidate.getSectorInterests()).isEmpty();
        }

        @Test
        @DisplayName("should default social category to GENERAL")
        void defaultCategory() {
            Candidate candidate = Fixtures.candidate().socialCategory(null).build();

            assertThat(candidate.getSocialCategory()).isEqualTo(SocialCategory.GENERAL);
        }

        @Test
        @DisplayName("should expose immutable skill sets")
        void immutableSkills() {
            Candidate candidate = Fixtures.candidate().build();

            assertThatThrownBy(() -> candidate.getSkills().add("java"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsBlankId() {
            assertThatThrownBy(() -> Fixtures.candidate().id("  ").build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("id");
        }

        @Test
        void rejectsMissingName() {
            assertThatThrownBy(() -> Fixtures.candidate().name(null).build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("name");
        }

        @Test
        void rejectsMissingEducation() {
            assertThatThrownBy(() -> Fixtures.candidate().educationLevel(null).build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("education_level");
        }

        @Test
        void rejectsMissingLocation() {
            assertThatThrownBy(() -> Fixtures.candidate().location("").build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("location");
        }
    }

    @Test
    @DisplayName("should flag diversity candidates")
    void diversityCandidate() {
        assertThat(Fixtures.candidate().build().isDiversityCandidate()).isFalse();
        assertThat(Fixtures.candidate().fromRuralArea(true).build().isDiversityCandidate()).isTrue();
        assertThat(Fixtures.candidate().socialCategory(SocialCategory.ST).build().isDiversityCandidate()).isTrue();
        assertThat(Fixtures.candidate().firstGenerationGraduate(true).build().isDiversityCandidate()).isTrue();
    }
}
