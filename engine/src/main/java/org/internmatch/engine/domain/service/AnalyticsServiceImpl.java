package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.capacity.CapacityTracker;
import org.internmatch.engine.domain.model.AnalyticsSummary;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Implementation of AnalyticsService. Reads capacity, never changes it.
 */
public final class AnalyticsServiceImpl implements AnalyticsService {

    private final CapacityTracker capacityTracker;

    public AnalyticsServiceImpl(CapacityTracker capacityTracker) {
        this.capacityTracker = Objects.requireNonNull(capacityTracker, "capacityTracker must not be null");
    }

    @Override
    public AnalyticsSummary summarize(Collection<Candidate> candidates, Collection<Internship> internships) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(internships, "internships must not be null");

        long diversityCandidates = candidates.stream().filter(Candidate::isDiversityCandidate).count();
        double diversityRate = candidates.isEmpty()
                ? 0.0
                : Math.round(diversityCandidates * 1000.0 / candidates.size()) / 10.0;

        Map<String, Integer> sectors = new TreeMap<>();
        int totalCapacity = 0;
        int remainingCapacity = 0;
        for (Internship internship : internships) {
            sectors.merge(internship.getSector(), 1, Integer::sum);
            totalCapacity += internship.getCapacity();
            remainingCapacity += capacityTracker.isRegistered(internship.getId())
                    ? capacityTracker.remaining(internship.getId())
                    : internship.getCapacity();
        }

        Map<String, Integer> locations = new TreeMap<>();
        Map<String, Integer> education = new LinkedHashMap<>();
        for (EducationLevel level : EducationLevel.values()) {
            education.put(level.getLabel(), 0);
        }
        for (Candidate candidate : candidates) {
            locations.merge(candidate.getLocation(), 1, Integer::sum);
            education.merge(candidate.getEducationLevel().getLabel(), 1, Integer::sum);
        }

        return new AnalyticsSummary(candidates.size(), internships.size(), diversityRate,
                sectors, locations, education, totalCapacity, remainingCapacity);
    }
}
