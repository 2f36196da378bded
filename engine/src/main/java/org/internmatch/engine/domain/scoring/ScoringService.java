package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoreBreakdown;
import org.internmatch.engine.domain.model.WeightConfig;

/**
 * Aggregates the factor scores of a candidate/internship pair into a recommendation.
 */
public interface ScoringService {

    /**
     * Score one pair. Higher is better.
     *
     * @param candidate  the candidate
     * @param internship the internship
     * @param weights    the weight vector to aggregate with
     * @return an unranked recommendation with overall score, breakdown and reasons
     */
    Recommendation score(Candidate candidate, Internship internship, WeightConfig weights);

    /**
     * Weighted sum of the breakdown, clamped to [0, 1].
     */
    double aggregate(ScoreBreakdown breakdown, WeightConfig weights);
}
