package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.ScoreFactor;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Skill overlap between a candidate and an internship's requirements.
 *
 * <p>Each required skill earns 1.0 on an exact normalized match, {@code partialCredit} when the
 * best {@link StringSimilarity} against any candidate skill exceeds {@code fuzzyThreshold},
 * otherwise 0.0. The score is the mean over required skills. An internship with no required
 * skills scores 1.0.
 */
public final class SkillMatcher implements FactorScorer {

    private static final Logger LOG = Logger.getLogger(SkillMatcher.class.getName());

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;
    public static final double DEFAULT_PARTIAL_CREDIT = 0.5;

    private final double fuzzyThreshold;
    private final double partialCredit;

    public SkillMatcher() {
        this(DEFAULT_FUZZY_THRESHOLD, DEFAULT_PARTIAL_CREDIT);
    }

    public SkillMatcher(double fuzzyThreshold, double partialCredit) {
        if (!(fuzzyThreshold > 0.0 && fuzzyThreshold <= 1.0)) {
            throw new IllegalArgumentException("fuzzyThreshold must be in (0, 1], got " + fuzzyThreshold);
        }
        if (!(partialCredit >= 0.0 && partialCredit <= 1.0)) {
            throw new IllegalArgumentException("partialCredit must be in [0, 1], got " + partialCredit);
        }
        this.fuzzyThreshold = fuzzyThreshold;
        this.partialCredit = partialCredit;
    }

    @Override
    public ScoreFactor factor() {
        return ScoreFactor.SKILL;
    }

    @Override
    public double score(Candidate candidate, Internship internship) {
        return match(candidate.getSkills(), internship.getSkillsRequired());
    }

    /**
     * Score normalized candidate skills against normalized required skills.
     */
    public double match(Set<String> candidateSkills, Set<String> requiredSkills) {
        if (requiredSkills.isEmpty()) {
            return 1.0;
        }
        double total = 0.0;
        for (String required : requiredSkills) {
            total += bestMatch(candidateSkills, required);
        }
        double score = total / requiredSkills.size();
        LOG.finest(() -> String.format("Skill match %s vs %s = %.3f", candidateSkills, requiredSkills, score));
        return score;
    }

    private double bestMatch(Set<String> candidateSkills, String required) {
        if (candidateSkills.contains(required)) {
            return 1.0;
        }
        for (String skill : candidateSkills) {
            if (StringSimilarity.similarity(skill, required) > fuzzyThreshold) {
                return partialCredit;
            }
        }
        return 0.0;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getPartialCredit() {
        return partialCredit;
    }
}
