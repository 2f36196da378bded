package org.internmatch.engine.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The five sub-scores of one candidate/internship pair, each clamped to [0, 1].
 */
public final class ScoreBreakdown {

    private final EnumMap<ScoreFactor, Double> scores;

    private ScoreBreakdown(EnumMap<ScoreFactor, Double> scores) {
        this.scores = scores;
    }

    public static ScoreBreakdown of(double skill, double location, double education, double sector, double diversity) {
        EnumMap<ScoreFactor, Double> scores = new EnumMap<>(ScoreFactor.class);
        scores.put(ScoreFactor.SKILL, clamp(skill));
        scores.put(ScoreFactor.LOCATION, clamp(location));
        scores.put(ScoreFactor.EDUCATION, clamp(education));
        scores.put(ScoreFactor.SECTOR, clamp(sector));
        scores.put(ScoreFactor.DIVERSITY, clamp(diversity));
        return new ScoreBreakdown(scores);
    }

    /**
     * Builds a breakdown from per-factor scores. Factors absent from the map score 0.
     */
    public static ScoreBreakdown of(Map<ScoreFactor, Double> values) {
        EnumMap<ScoreFactor, Double> scores = new EnumMap<>(ScoreFactor.class);
        for (ScoreFactor factor : ScoreFactor.values()) {
            Double value = values.get(factor);
            scores.put(factor, clamp(value != null ? value : 0.0));
        }
        return new ScoreBreakdown(scores);
    }

    /**
     * Clamp a score into [0, 1]. NaN maps to 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public double get(ScoreFactor factor) {
        return scores.get(factor);
    }

    public double getSkill() {
        return get(ScoreFactor.SKILL);
    }

    public double getLocation() {
        return get(ScoreFactor.LOCATION);
    }

    public double getEducation() {
        return get(ScoreFactor.EDUCATION);
    }

    public double getSector() {
        return get(ScoreFactor.SECTOR);
    }

    public double getDiversity() {
        return get(ScoreFactor.DIVERSITY);
    }

    /**
     * Sub-scores keyed by breakdown name (skill_match, location_match, ...), in factor order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        scores.forEach((factor, score) -> map.put(factor.getBreakdownKey(), score));
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreBreakdown)) {
            return false;
        }
        return scores.equals(((ScoreBreakdown) o).scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return String.format("skill=%.3f, location=%.3f, education=%.3f, sector=%.3f, diversity=%.3f",
                getSkill(), getLocation(), getEducation(), getSector(), getDiversity());
    }
}
