package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreFactor;
import org.internmatch.engine.domain.model.Terms;

/**
 * 1.0 when the internship's sector is among the candidate's interests, else 0.0.
 */
public final class SectorScorer implements FactorScorer {

    @Override
    public ScoreFactor factor() {
        return ScoreFactor.SECTOR;
    }

    @Override
    public double score(Candidate candidate, Internship internship) {
        return candidate.getSectorInterests().contains(Terms.normalize(internship.getSector())) ? 1.0 : 0.0;
    }
}
