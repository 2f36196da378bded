package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.capacity.InMemoryCapacityTracker;
import org.internmatch.engine.domain.model.AnalyticsSummary;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.SocialCategory;
import org.internmatch.engine.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AnalyticsServiceImplTest {

    @Test
    void summarizesCandidatesAndInternships() {
        List<Candidate> candidates = Arrays.asList(
                Fixtures.candidate().id("c-1").build(),
                Fixtures.candidate().id("c-2").location("Delhi").fromRuralArea(true).build(),
                Fixtures.candidate().id("c-3").educationLevel(EducationLevel.MASTER)
                        .socialCategory(SocialCategory.ST).build());
        List<Internship> internships = Arrays.asList(
                Fixtures.internship("i-1").capacity(2).build(),
                Fixtures.internship("i-2").sector("Finance").capacity(3).build());
        InMemoryCapacityTracker tracker = new InMemoryCapacityTracker(internships);
        tracker.allocate("i-2", "alloc-1");

        AnalyticsSummary summary = new AnalyticsServiceImpl(tracker).summarize(candidates, internships);

        assertThat(summary.getTotalCandidates()).isEqualTo(3);
        assertThat(summary.getTotalInternships()).isEqualTo(2);
        assertThat(summary.getDiversityRate()).isEqualTo(66.7);
        assertThat(summary.getSectorDistribution()).containsExactly(entry("Finance", 1), entry("Technology", 1));
        assertThat(summary.getLocationDistribution()).containsExactly(entry("Delhi", 1), entry("Pune", 2));
        assertThat(summary.getEducationDistribution()).containsExactly(
                entry(EducationLevel.DIPLOMA.getLabel(), 0),
                entry(EducationLevel.BACHELOR.getLabel(), 2),
                entry(EducationLevel.MASTER.getLabel(), 1),
                entry(EducationLevel.PHD.getLabel(), 0));
        assertThat(summary.getTotalCapacity()).isEqualTo(5);
        assertThat(summary.getRemainingCapacity()).isEqualTo(4);
    }

    @Test
    void emptyInputs() {
        AnalyticsSummary summary = new AnalyticsServiceImpl(new InMemoryCapacityTracker())
                .summarize(Collections.emptyList(), Collections.emptyList());

        assertThat(summary.getDiversityRate()).isZero();
        assertThat(summary.getTotalCapacity()).isZero();
        assertThat(summary.getSectorDistribution()).isEmpty();
    }
}
