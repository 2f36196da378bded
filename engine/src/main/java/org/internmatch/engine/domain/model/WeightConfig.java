package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weight vector for score aggregation.
 * The five weights are non-negative and sum to 1.0.
 */
public final class WeightConfig {

    public static final double SUM_TOLERANCE = 1e-6;

    private static final WeightConfig DEFAULTS = new WeightConfig(0.30, 0.20, 0.20, 0.15, 0.15);

    private final Map<ScoreFactor, Double> weights;

    private WeightConfig(double skill, double location, double education, double sector, double diversity) {
        EnumMap<ScoreFactor, Double> values = new EnumMap<>(ScoreFactor.class);
        values.put(ScoreFactor.SKILL, skill);
        values.put(ScoreFactor.LOCATION, location);
        values.put(ScoreFactor.EDUCATION, education);
        values.put(ScoreFactor.SECTOR, sector);
        values.put(ScoreFactor.DIVERSITY, diversity);

        double sum = 0.0;
        for (Map.Entry<ScoreFactor, Double> entry : values.entrySet()) {
            double w = entry.getValue();
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0.0) {
                throw new ValidationException("Weight " + entry.getKey().getWeightKey()
                        + " must be a finite non-negative number, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ValidationException(String.format("Weights must sum to 1.0, got %.6f", sum));
        }
        this.weights = Collections.unmodifiableMap(values);
    }

    /**
     * Default weights: skill 0.30, location 0.20, education 0.20, sector 0.15, diversity 0.15.
     */
    public static WeightConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a weight vector that must already sum to 1.0.
     *
     * @throws ValidationException if a weight is negative or the sum is off
     */
    public static WeightConfig of(double skill, double location, double education, double sector, double diversity) {
        return new WeightConfig(skill, location, education, sector, diversity);
    }

    /**
     * Creates a weight vector from a map keyed by factor weight keys ("skill", "location", ...).
     * All five keys are required and must sum to 1.0.
     */
    public static WeightConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new WeightConfig(
                require(values, ScoreFactor.SKILL),
                require(values, ScoreFactor.LOCATION),
                require(values, ScoreFactor.EDUCATION),
                require(values, ScoreFactor.SECTOR),
                require(values, ScoreFactor.DIVERSITY));
    }

    /**
     * Creates a weight vector from weights on any scale (for example percentages).
     * Missing keys count as zero; the result is rescaled to sum to 1.0.
     *
     * @throws ValidationException if a weight is negative, all weights are zero or their sum overflows
     */
    public static WeightConfig normalized(Map<String, ? extends Number> rawWeights) {
        Objects.requireNonNull(rawWeights, "rawWeights must not be null");
        double[] raw = new double[ScoreFactor.values().length];
        double total = 0.0;
        for (ScoreFactor factor : ScoreFactor.values()) {
            Number value = rawWeights.get(factor.getWeightKey());
            double w = value != null ? value.doubleValue() : 0.0;
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0.0) {
                throw new ValidationException("Weight " + factor.getWeightKey() + " must be non-negative, got " + value);
            }
            raw[factor.ordinal()] = w;
            total += w;
        }
        if (Double.isInfinite(total)) {
            throw new ValidationException("Weights are too large to normalize, sum overflows: " + rawWeights);
        }
        if (total <= 0.0) {
            throw new ValidationException("At least one weight must be positive");
        }
        // last weight absorbs rounding so the sum is exact
        double skill = raw[0] / total;
        double location = raw[1] / total;
        double education = raw[2] / total;
        double sector = raw[3] / total;
        double diversity = Math.max(0.0, 1.0 - skill - location - education - sector);
        return new WeightConfig(skill, location, education, sector, diversity);
    }

    private static double require(Map<String, Double> values, ScoreFactor factor) {
        Double value = values.get(factor.getWeightKey());
        if (value == null) {
            throw new ValidationException("Missing weight: " + factor.getWeightKey());
        }
        return value;
    }

    public double get(ScoreFactor factor) {
        return weights.get(factor);
    }

    public double getSkillWeight() {
        return get(ScoreFactor.SKILL);
    }

    public double getLocationWeight() {
        return get(ScoreFactor.LOCATION);
    }

    public double getEducationWeight() {
        return get(ScoreFactor.EDUCATION);
    }

    public double getSectorWeight() {
        return get(ScoreFactor.SECTOR);
    }

    public double getDiversityWeight() {
        return get(ScoreFactor.DIVERSITY);
    }

    /**
     * Weights keyed by factor weight key, in aggregation order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        weights.forEach((factor, w) -> map.put(factor.getWeightKey(), w));
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeightConfig)) {
            return false;
        }
        return weights.equals(((WeightConfig) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "WeightConfig" + asMap();
    }
}
