package org.internmatch.engine.domain.model;

/**
 * The five factors of the match score, in aggregation order.
 */
public enum ScoreFactor {
    SKILL("skill", "skill_match"),
    LOCATION("location", "location_match"),
    EDUCATION("education", "education_match"),
    SECTOR("sector", "sector_match"),
    DIVERSITY("diversity", "diversity_bonus");

    private final String weightKey;
    private final String breakdownKey;

    ScoreFactor(String weightKey, String breakdownKey) {
        this.weightKey = weightKey;
        this.breakdownKey = breakdownKey;
    }

    /**
     * Key of this factor in a weight configuration.
     */
    public String getWeightKey() {
        return weightKey;
    }

    /**
     * Key of this factor in a score breakdown.
     */
    public String getBreakdownKey() {
        return breakdownKey;
    }
}
