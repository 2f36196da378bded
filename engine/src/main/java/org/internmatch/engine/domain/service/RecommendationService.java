package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoringRequest;

import java.util.List;

/**
 * Ranks internships for a single candidate.
 */
public interface RecommendationService {

    /**
     * Candidate-facing ranking. Internships without remaining capacity are excluded.
     *
     * @param request the validated request
     * @return at most {@code topK} recommendations, best first, ranked 1..n
     */
    List<Recommendation> recommend(ScoringRequest request);

    /**
     * Administrative ranking that keeps internships without remaining capacity.
     *
     * @param request the validated request
     * @return at most {@code topK} recommendations, best first, ranked 1..n
     */
    List<Recommendation> rankAll(ScoringRequest request);
}
