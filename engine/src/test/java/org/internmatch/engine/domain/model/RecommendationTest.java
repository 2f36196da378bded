package org.internmatch.engine.domain.model;

import org.internmatch.engine.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class RecommendationTest {

    private static Recommendation rec(String internshipId, double overall, double skill) {
        return Recommendation.builder()
                .candidateId("c-1")
                .internship(Fixtures.internship(internshipId).build())
                .overallScore(overall)
                .breakdown(ScoreBreakdown.of(skill, 0, 0, 0, 0))
                .reasons(Collections.emptyList())
                .build();
    }

    @Test
    void ordersByOverallThenSkillThenId() {
        Recommendation best = rec("z", 0.9, 0.1);
        Recommendation tieHighSkill = rec("y", 0.5, 0.8);
        Recommendation tieLowSkillA = rec("a", 0.5, 0.2);
        Recommendation tieLowSkillB = rec("b", 0.5, 0.2);

        List<Recommendation> list = new ArrayList<>(Arrays.asList(tieLowSkillB, tieLowSkillA, best, tieHighSkill));
        Collections.sort(list);

        assertThat(list).extracting(Recommendation::getInternshipId).containsExactly("z", "y", "a", "b");
    }

    @Test
    void internshipIdOrderComparesDigitsByValue() {
        List<String> ids = new ArrayList<>(Arrays.asList("10", "i-2", "3a", "9", "007", "2", "i-10"));
        ids.sort(Recommendation.INTERNSHIP_ID_ORDER);

        assertThat(ids).containsExactly("2", "007", "9", "10", "3a", "i-10", "i-2");
        assertThat(Recommendation.INTERNSHIP_ID_ORDER.compare("07", "7")).isLessThan(0);
    }

    @Test
    void clampsOverallScore() {
        assertThat(rec("a", 1.7, 0).getOverallScore()).isEqualTo(1.0);
        assertThat(rec("a", -0.1, 0).getOverallScore()).isEqualTo(0.0);
    }

    @Test
    void withRankCopiesEverythingElse() {
        Recommendation original = rec("a", 0.4, 0.3);

        Recommendation ranked = original.withRank(2);

        assertThat(ranked.getRank()).isEqualTo(2);
        assertThat(original.getRank()).isZero();
        assertThat(ranked.getOverallScore()).isEqualTo(original.getOverallScore());
        assertThat(ranked.getBreakdown()).isEqualTo(original.getBreakdown());
    }

    @Test
    void breakdownClampsAndUsesWireNames() {
        ScoreBreakdown breakdown = ScoreBreakdown.of(1.2, -0.5, Double.NaN, 0.5, 1.0);

        assertThat(breakdown.asMap()).containsExactly(
                entry("skill_match", 1.0),
                entry("location_match", 0.0),
                entry("education_match", 0.0),
                entry("sector_match", 0.5),
                entry("diversity_bonus", 1.0));
    }
}
