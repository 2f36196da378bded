package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.capacity.InMemoryCapacityTracker;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoreBreakdown;
import org.internmatch.engine.domain.model.ScoringRequest;
import org.internmatch.engine.domain.model.WeightConfig;
import org.internmatch.engine.domain.scoring.ScoringService;
import org.internmatch.engine.domain.scoring.ScoringServiceImpl;
import org.internmatch.engine.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecommendationServiceImplTest {

    private static List<String> ids(List<Recommendation> recommendations) {
        return recommendations.stream().map(Recommendation::getInternshipId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("with real scoring")
    class WithRealScoring {

        private InMemoryCapacityTracker tracker;
        private RecommendationServiceImpl service;

        @BeforeEach
        void setUp() {
            tracker = new InMemoryCapacityTracker();
            service = new RecommendationServiceImpl(new ScoringServiceImpl(), tracker);
        }

        @Test
        @DisplayName("results are ranked 1..n by descending overall score")
        void ranksByOverallScore() {
            Internship perfect = Fixtures.internship("a").build();
            Internship otherCity = Fixtures.internship("b").location("Delhi").build();
            Internship otherSector = Fixtures.internship("c").location("Delhi").sector("Finance").build();

            List<Recommendation> result = service.recommend(
                    ScoringRequest.of(Fixtures.candidate().build(), Arrays.asList(otherSector, perfect, otherCity)));

            assertThat(ids(result)).containsExactly("a", "b", "c");
            assertThat(result).extracting(Recommendation::getRank).containsExactly(1, 2, 3);
            assertThat(result.get(0).getOverallScore()).isGreaterThan(result.get(1).getOverallScore());
        }

        @Test
        @DisplayName("equal scores fall back to internship id ascending")
        void tieBreaksOnInternshipId() {
            List<Internship> internships = Arrays.asList(
                    Fixtures.internship("i-3").build(),
                    Fixtures.internship("i-1").build(),
                    Fixtures.internship("i-2").build());

            List<Recommendation> result = service.recommend(ScoringRequest.of(Fixtures.candidate().build(), internships));

            assertThat(ids(result)).containsExactly("i-1", "i-2", "i-3");
        }

        @Test
        @DisplayName("numeric ids tie-break by value, not by text")
        void tieBreaksNumericIdsByValue() {
            List<Internship> internships = Arrays.asList(
                    Fixtures.internship("9").build(),
                    Fixtures.internship("10").build(),
                    Fixtures.internship("2").build());

            List<Recommendation> result = service.recommend(ScoringRequest.of(Fixtures.candidate().build(), internships));

            assertThat(ids(result)).containsExactly("2", "9", "10");
        }

        @Test
        @DisplayName("the list is truncated to top-K")
        void truncatesToTopK() {
            List<Internship> internships = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                internships.add(Fixtures.internship("i-" + i).build());
            }

            assertThat(service.recommend(ScoringRequest.of(Fixtures.candidate().build(), internships))).hasSize(5);
            assertThat(service.recommend(ScoringRequest.of(Fixtures.candidate().build(), internships,
                    WeightConfig.defaults(), 2))).hasSize(2);
            assertThat(service.recommend(ScoringRequest.of(Fixtures.candidate().build(), internships,
                    WeightConfig.defaults(), 20))).hasSize(8);
        }

        @Test
        @DisplayName("no internships yields an empty list")
        void emptyCatalog() {
            assertThat(service.recommend(ScoringRequest.of(Fixtures.candidate().build(), Collections.emptyList())))
                    .isEmpty();
        }

        @Test
        @DisplayName("internships without capacity are excluded from recommend but kept by rankAll")
        void zeroCapacity() {
            Internship full = Fixtures.internship("full").capacity(0).build();
            Internship open = Fixtures.internship("open").location("Delhi").build();
            ScoringRequest request = ScoringRequest.of(Fixtures.candidate().build(), Arrays.asList(full, open));

            assertThat(ids(service.recommend(request))).containsExactly("open");
            assertThat(ids(service.rankAll(request))).containsExactly("full", "open");
        }

        @Test
        @DisplayName("tracked remaining capacity overrides the record")
        void usesTrackedCapacity() {
            Internship internship = Fixtures.internship("i-1").capacity(1).build();
            tracker.register("i-1", 1);
            tracker.allocate("i-1", "alloc-1");

            assertThat(service.recommend(ScoringRequest.of(Fixtures.candidate().build(),
                    Collections.singletonList(internship)))).isEmpty();
        }

        @Test
        @DisplayName("recommending never changes capacity")
        void doesNotMutateCapacity() {
            Internship internship = Fixtures.internship("i-1").capacity(2).build();
            tracker.register("i-1", 2);
            Map<String, Integer> before = tracker.snapshot();

            service.recommend(ScoringRequest.of(Fixtures.candidate().build(), Collections.singletonList(internship)));
            service.rankAll(ScoringRequest.of(Fixtures.candidate().build(), Collections.singletonList(internship)));

            assertThat(tracker.snapshot()).isEqualTo(before);
        }

        @Test
        @DisplayName("same input gives the same output")
        void deterministic() {
            List<Internship> internships = Arrays.asList(
                    Fixtures.internship("x").location("Delhi").build(),
                    Fixtures.internship("y").build(),
                    Fixtures.internship("z").sector("Finance").build());
            Candidate candidate = Fixtures.candidate().build();

            List<Recommendation> first = service.recommend(ScoringRequest.of(candidate, internships));
            List<Recommendation> second = service.recommend(ScoringRequest.of(candidate, internships));

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("with stubbed scoring")
    @ExtendWith(MockitoExtension.class)
    class WithStubbedScoring {

        @Mock
        private ScoringService scoringService;

        @Test
        @DisplayName("equal overall scores are ordered by skill score")
        void tieBreaksOnSkill() {
            Candidate candidate = Fixtures.candidate().build();
            Internship low = Fixtures.internship("a").build();
            Internship high = Fixtures.internship("b").build();
            when(scoringService.score(eq(candidate), eq(low), any())).thenReturn(stub(candidate, low, 0.6, 0.4));
            when(scoringService.score(eq(candidate), eq(high), any())).thenReturn(stub(candidate, high, 0.6, 0.9));

            RecommendationServiceImpl service = new RecommendationServiceImpl(scoringService, new InMemoryCapacityTracker());
            List<Recommendation> result = service.recommend(ScoringRequest.of(candidate, Arrays.asList(low, high)));

            assertThat(ids(result)).containsExactly("b", "a");
        }

        @Test
        @DisplayName("internships without capacity are never scored")
        void skipsScoringFullInternships() {
            Candidate candidate = Fixtures.candidate().build();
            Internship full = Fixtures.internship("full").capacity(0).build();

            RecommendationServiceImpl service = new RecommendationServiceImpl(scoringService, new InMemoryCapacityTracker());
            assertThat(service.recommend(ScoringRequest.of(candidate, Collections.singletonList(full)))).isEmpty();

            verify(scoringService, never()).score(any(), any(), any());
        }

        private Recommendation stub(Candidate candidate, Internship internship, double overall, double skill) {
            return Recommendation.builder()
                    .candidateId(candidate.getId())
                    .internship(internship)
                    .overallScore(overall)
                    .breakdown(ScoreBreakdown.of(skill, 0.0, 0.0, 0.0, 0.0))
                    .reasons(Collections.emptyList())
                    .build();
        }
    }
}
