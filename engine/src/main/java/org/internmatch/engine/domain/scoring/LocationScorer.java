package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreFactor;
import org.internmatch.engine.domain.model.Terms;

/**
 * Geographic and placement-preference fit.
 *
 * <p>Same location (case-insensitive) scores 1.0. Otherwise a rural-friendly internship for a
 * candidate who prefers rural placements scores 0.8. Anything else gets the 0.2 floor.
 * There is no regional proximity table.
 */
public final class LocationScorer implements FactorScorer {

    public static final double EXACT_MATCH = 1.0;
    public static final double RURAL_PREFERENCE_MATCH = 0.8;
    public static final double BASELINE = 0.2;

    @Override
    public ScoreFactor factor() {
        return ScoreFactor.LOCATION;
    }

    @Override
    public double score(Candidate candidate, Internship internship) {
        if (Terms.normalize(candidate.getLocation()).equals(Terms.normalize(internship.getLocation()))) {
            return EXACT_MATCH;
        }
        if (internship.isRuralFriendly() && candidate.isPrefersRural()) {
            return RURAL_PREFERENCE_MATCH;
        }
        return BASELINE;
    }
}
