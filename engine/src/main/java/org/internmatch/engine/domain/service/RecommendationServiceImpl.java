package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.capacity.CapacityTracker;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoringRequest;
import org.internmatch.engine.domain.scoring.ScoringService;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of RecommendationService.
 * Scores every internship, filters on remaining capacity, sorts and truncates to top-K.
 * Never mutates capacity.
 */
public final class RecommendationServiceImpl implements RecommendationService {

    private static final Logger LOG = Logger.getLogger(RecommendationServiceImpl.class.getName());

    private final ScoringService scoringService;
    private final CapacityTracker capacityTracker;

    public RecommendationServiceImpl(ScoringService scoringService, CapacityTracker capacityTracker) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.capacityTracker = Objects.requireNonNull(capacityTracker, "capacityTracker must not be null");
    }

    @Override
    public List<Recommendation> recommend(ScoringRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Recommendation> ranked = rank(request, this::hasRemainingCapacity);
        LOG.info(() -> String.format("Recommended %d of %d internships for candidate %s",
                ranked.size(), request.getInternships().size(), request.getCandidate().getId()));
        return ranked;
    }

    @Override
    public List<Recommendation> rankAll(ScoringRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return rank(request, internship -> true);
    }

    private List<Recommendation> rank(ScoringRequest request, Predicate<Internship> eligible) {
        List<Recommendation> sorted = request.getInternships().stream()
                .filter(eligible)
                .map(internship -> scoringService.score(request.getCandidate(), internship, request.getWeights()))
                .sorted()
                .limit(request.getTopK())
                .collect(Collectors.toList());

        List<Recommendation> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return ranked;
    }

    /**
     * Live remaining count when tracked, otherwise the capacity on the record.
     */
    private boolean hasRemainingCapacity(Internship internship) {
        int remaining = capacityTracker.isRegistered(internship.getId())
                ? capacityTracker.remaining(internship.getId())
                : internship.getCapacity();
        if (remaining == 0) {
            LOG.fine(() -> "Skipping internship without remaining capacity: " + internship.getId());
            return false;
        }
        return true;
    }
}
