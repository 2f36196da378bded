package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoreBreakdown;
import org.internmatch.engine.domain.model.ScoreFactor;
import org.internmatch.engine.domain.model.WeightConfig;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using a weighted sum of five factor scores.
 *
 * <pre>
 *   overall = w_skill * skill
 *           + w_location * location
 *           + w_education * education
 *           + w_sector * sector
 *           + w_diversity * diversity
 * </pre>
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    private final Map<ScoreFactor, FactorScorer> scorers;
    private final MatchReasonGenerator reasonGenerator;

    public ScoringServiceImpl() {
        this(SkillMatcher.DEFAULT_FUZZY_THRESHOLD, SkillMatcher.DEFAULT_PARTIAL_CREDIT);
    }

    public ScoringServiceImpl(double fuzzyThreshold, double partialCredit) {
        this(Arrays.asList(
                new SkillMatcher(fuzzyThreshold, partialCredit),
                new LocationScorer(),
                new EducationScorer(),
                new SectorScorer(),
                new DiversityScorer()), new MatchReasonGenerator());
    }

    /**
     * @param scorers exactly one scorer per {@link ScoreFactor}
     */
    public ScoringServiceImpl(Collection<? extends FactorScorer> scorers, MatchReasonGenerator reasonGenerator) {
        Objects.requireNonNull(scorers, "scorers must not be null");
        this.reasonGenerator = Objects.requireNonNull(reasonGenerator, "reasonGenerator must not be null");

        EnumMap<ScoreFactor, FactorScorer> byFactor = new EnumMap<>(ScoreFactor.class);
        for (FactorScorer scorer : scorers) {
            if (byFactor.put(scorer.factor(), scorer) != null) {
                throw new IllegalArgumentException("Duplicate scorer for factor " + scorer.factor());
            }
        }
        if (byFactor.size() != ScoreFactor.values().length) {
            throw new IllegalArgumentException("A scorer is required for every factor, got " + byFactor.keySet());
        }
        this.scorers = byFactor;
    }

    @Override
    public Recommendation score(Candidate candidate, Internship internship, WeightConfig weights) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(internship, "internship must not be null");
        Objects.requireNonNull(weights, "weights must not be null");

        EnumMap<ScoreFactor, Double> values = new EnumMap<>(ScoreFactor.class);
        for (Map.Entry<ScoreFactor, FactorScorer> entry : scorers.entrySet()) {
            values.put(entry.getKey(), entry.getValue().score(candidate, internship));
        }
        ScoreBreakdown breakdown = ScoreBreakdown.of(values);
        double overall = aggregate(breakdown, weights);
        List<String> reasons = reasonGenerator.reasonsFor(breakdown);

        LOG.fine(() -> String.format("Scored %s for %s: %s, overall=%.3f",
                internship.getId(), candidate.getId(), breakdown, overall));

        return Recommendation.builder()
                .candidateId(candidate.getId())
                .internship(internship)
                .overallScore(overall)
                .breakdown(breakdown)
                .reasons(reasons)
                .build();
    }

    @Override
    public double aggregate(ScoreBreakdown breakdown, WeightConfig weights) {
        double overall = 0.0;
        for (ScoreFactor factor : ScoreFactor.values()) {
            overall += weights.get(factor) * breakdown.get(factor);
        }
        return ScoreBreakdown.clamp(overall);
    }
}
