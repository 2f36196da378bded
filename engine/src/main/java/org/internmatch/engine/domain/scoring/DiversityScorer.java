package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreBreakdown;
import org.internmatch.engine.domain.model.ScoreFactor;

/**
 * Affirmative-action bonus.
 *
 * <p>Bonuses add up and the total is clamped to 1.0:
 * <ul>
 *   <li>+0.4 rural origin on a rural-friendly internship</li>
 *   <li>+0.4 SC/ST/OBC on a diversity-focused internship</li>
 *   <li>+0.2 first-generation graduate on a diversity-focused internship</li>
 * </ul>
 */
public final class DiversityScorer implements FactorScorer {

    public static final double RURAL_BONUS = 0.4;
    public static final double SOCIAL_CATEGORY_BONUS = 0.4;
    public static final double FIRST_GENERATION_BONUS = 0.2;

    @Override
    public ScoreFactor factor() {
        return ScoreFactor.DIVERSITY;
    }

    @Override
    public double score(Candidate candidate, Internship internship) {
        double bonus = 0.0;
        if (candidate.isFromRuralArea() && internship.isRuralFriendly()) {
            bonus += RURAL_BONUS;
        }
        if (internship.isDiversityFocused()) {
            if (candidate.getSocialCategory().isReserved()) {
                bonus += SOCIAL_CATEGORY_BONUS;
            }
            if (candidate.isFirstGenerationGraduate()) {
                bonus += FIRST_GENERATION_BONUS;
            }
        }
        return ScoreBreakdown.clamp(bonus);
    }
}
