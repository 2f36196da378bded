package org.internmatch.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate figures for the administrative dashboard.
 */
public final class AnalyticsSummary {

    private final int totalCandidates;
    private final int totalInternships;
    private final double diversityRate;
    private final Map<String, Integer> sectorDistribution;
    private final Map<String, Integer> locationDistribution;
    private final Map<String, Integer> educationDistribution;
    private final int totalCapacity;
    private final int remainingCapacity;

    public AnalyticsSummary(int totalCandidates,
                            int totalInternships,
                            double diversityRate,
                            Map<String, Integer> sectorDistribution,
                            Map<String, Integer> locationDistribution,
                            Map<String, Integer> educationDistribution,
                            int totalCapacity,
                            int remainingCapacity) {
        this.totalCandidates = totalCandidates;
        this.totalInternships = totalInternships;
        this.diversityRate = diversityRate;
        this.sectorDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(sectorDistribution));
        this.locationDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(locationDistribution));
        this.educationDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(educationDistribution));
        this.totalCapacity = totalCapacity;
        this.remainingCapacity = remainingCapacity;
    }

    public int getTotalCandidates() {
        return totalCandidates;
    }

    public int getTotalInternships() {
        return totalInternships;
    }

    /**
     * Share of candidates with at least one affirmative-action attribute, in percent, one decimal.
     */
    public double getDiversityRate() {
        return diversityRate;
    }

    public Map<String, Integer> getSectorDistribution() {
        return sectorDistribution;
    }

    public Map<String, Integer> getLocationDistribution() {
        return locationDistribution;
    }

    public Map<String, Integer> getEducationDistribution() {
        return educationDistribution;
    }

    public int getTotalCapacity() {
        return totalCapacity;
    }

    public int getRemainingCapacity() {
        return remainingCapacity;
    }

    @Override
    public String toString() {
        return String.format("AnalyticsSummary{candidates=%d, internships=%d, diversityRate=%.1f%%, capacity=%d/%d}",
                totalCandidates, totalInternships, diversityRate, remainingCapacity, totalCapacity);
    }
}
