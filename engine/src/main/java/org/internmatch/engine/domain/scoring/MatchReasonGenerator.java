package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Human-readable reasons for a match. Rules are independent and reported in a fixed order.
 */
public final class MatchReasonGenerator {

    public static final String STRONG_SKILLS = "Strong skill alignment";
    public static final String PERFECT_LOCATION = "Perfect location match";
    public static final String EDUCATION_MATCH = "Education level matches requirement";
    public static final String SECTOR_ALIGNED = "Sector interest aligned";
    public static final String AFFIRMATIVE_ACTION = "Eligible for affirmative-action consideration";

    public static final double STRONG_SKILL_THRESHOLD = 0.7;

    public List<String> reasonsFor(ScoreBreakdown breakdown) {
        List<String> reasons = new ArrayList<>(5);
        if (breakdown.getSkill() >= STRONG_SKILL_THRESHOLD) {
            reasons.add(STRONG_SKILLS);
        }
        if (breakdown.getLocation() == 1.0) {
            reasons.add(PERFECT_LOCATION);
        }
        if (breakdown.getEducation() == 1.0) {
            reasons.add(EDUCATION_MATCH);
        }
        if (breakdown.getSector() == 1.0) {
            reasons.add(SECTOR_ALIGNED);
        }
        if (breakdown.getDiversity() > 0.0) {
            reasons.add(AFFIRMATIVE_ACTION);
        }
        return Collections.unmodifiableList(reasons);
    }
}
