package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreFactor;

/**
 * Education fit against the internship's minimum level.
 * Equal scores 1.0, overqualified 0.8, below the requirement 0.0.
 */
public final class EducationScorer implements FactorScorer {

    public static final double EXACT_LEVEL = 1.0;
    public static final double OVERQUALIFIED = 0.8;
    public static final double UNDERQUALIFIED = 0.0;

    @Override
    public ScoreFactor factor() {
        return ScoreFactor.EDUCATION;
    }

    @Override
    public double score(Candidate candidate, Internship internship) {
        return score(candidate.getEducationLevel(), internship.getEducationLevel());
    }

    public double score(EducationLevel candidateLevel, EducationLevel requiredLevel) {
        if (candidateLevel == requiredLevel) {
            return EXACT_LEVEL;
        }
        return candidateLevel.isAbove(requiredLevel) ? OVERQUALIFIED : UNDERQUALIFIED;
    }
}
