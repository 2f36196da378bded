package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One validated ranking request: a candidate, the internships to rank, the weights and top-K.
 */
public final class ScoringRequest {

    public static final int DEFAULT_TOP_K = 5;

    private final Candidate candidate;
    private final List<Internship> internships;
    private final WeightConfig weights;
    private final int topK;

    private ScoringRequest(Candidate candidate, Collection<Internship> internships, WeightConfig weights, int topK) {
        if (candidate == null) {
            throw new ValidationException("candidate is required");
        }
        if (internships == null) {
            throw new ValidationException("internships are required");
        }
        if (topK < 1) {
            throw new ValidationException("topK must be at least 1, got " + topK);
        }
        List<Internship> copy = new ArrayList<>(internships.size());
        Set<String> seen = new HashSet<>();
        for (Internship internship : internships) {
            if (internship == null) {
                throw new ValidationException("internships must not contain null entries");
            }
            if (!seen.add(internship.getId())) {
                throw new ValidationException("Duplicate internship id: " + internship.getId());
            }
            copy.add(internship);
        }
        this.candidate = candidate;
        this.internships = Collections.unmodifiableList(copy);
        this.weights = weights != null ? weights : WeightConfig.defaults();
        this.topK = topK;
    }

    /**
     * @throws ValidationException if the candidate or internships are missing, an internship id
     *                             repeats, or topK is below 1
     */
    public static ScoringRequest of(Candidate candidate, Collection<Internship> internships,
                                    WeightConfig weights, int topK) {
        return new ScoringRequest(candidate, internships, weights, topK);
    }

    public static ScoringRequest of(Candidate candidate, Collection<Internship> internships) {
        return new ScoringRequest(candidate, internships, WeightConfig.defaults(), DEFAULT_TOP_K);
    }

    public Candidate getCandidate() {
        return candidate;
    }

    public List<Internship> getInternships() {
        return internships;
    }

    public WeightConfig getWeights() {
        return weights;
    }

    public int getTopK() {
        return topK;
    }

    @Override
    public String toString() {
        return String.format("ScoringRequest{candidate='%s', internships=%d, topK=%d, weights=%s}",
                candidate.getId(), internships.size(), topK, weights);
    }
}
