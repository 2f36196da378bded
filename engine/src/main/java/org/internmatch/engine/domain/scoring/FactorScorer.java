package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreFactor;

/**
 * Scores one factor of a candidate/internship pair.
 * Implementations are pure and safe to call from any thread.
 */
public interface FactorScorer {

    /**
     * The factor this scorer produces.
     */
    ScoreFactor factor();

    /**
     * @return a score in [0, 1]
     */
    double score(Candidate candidate, Internship internship);
}
