package org.internmatch.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable scored match of one internship for one candidate.
 * Rank is 0 until the recommendation has been placed in an ordered result.
 */
public final class Recommendation implements Comparable<Recommendation> {

    /**
     * Internship ids ascending. All-digit ids sort first by numeric value, other ids follow in text order.
     */
    public static final Comparator<String> INTERNSHIP_ID_ORDER = Recommendation::compareIds;

    /**
     * Overall descending, then skill descending, then internship id ascending.
     */
    public static final Comparator<Recommendation> RANKING_ORDER =
            Comparator.comparingDouble(Recommendation::getOverallScore).reversed()
                    .thenComparing(Comparator.comparingDouble((Recommendation r) -> r.getBreakdown().getSkill()).reversed())
                    .thenComparing(Recommendation::getInternshipId, INTERNSHIP_ID_ORDER);

    private final String candidateId;
    private final Internship internship;
    private final double overallScore;
    private final ScoreBreakdown breakdown;
    private final List<String> reasons;
    private final int rank;

    private Recommendation(Builder builder) {
        this.candidateId = Objects.requireNonNull(builder.candidateId, "candidateId must not be null");
        this.internship = Objects.requireNonNull(builder.internship, "internship must not be null");
        this.breakdown = Objects.requireNonNull(builder.breakdown, "breakdown must not be null");
        this.overallScore = ScoreBreakdown.clamp(builder.overallScore);
        this.reasons = builder.reasons == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(builder.reasons));
        if (builder.rank < 0) {
            throw new IllegalArgumentException("rank must not be negative");
        }
        this.rank = builder.rank;
    }

    private static int compareIds(String a, String b) {
        boolean numericA = isDigits(a);
        boolean numericB = isDigits(b);
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        if (numericA) {
            String left = stripLeadingZeros(a);
            String right = stripLeadingZeros(b);
            int byValue = left.length() != right.length()
                    ? Integer.compare(left.length(), right.length())
                    : left.compareTo(right);
            if (byValue != 0) {
                return byValue;
            }
        }
        return a.compareTo(b);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    public String getCandidateId() {
        return candidateId;
    }

    public String getInternshipId() {
        return internship.getId();
    }

    public Internship getInternship() {
        return internship;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public ScoreBreakdown getBreakdown() {
        return breakdown;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Copy of this recommendation placed at the given rank.
     */
    public Recommendation withRank(int rank) {
        return toBuilder().rank(rank).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .candidateId(candidateId)
                .internship(internship)
                .overallScore(overallScore)
                .breakdown(breakdown)
                .reasons(reasons)
                .rank(rank);
    }

    @Override
    public int compareTo(Recommendation other) {
        return RANKING_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Recommendation)) {
            return false;
        }
        Recommendation that = (Recommendation) o;
        return Double.compare(that.overallScore, overallScore) == 0
                && rank == that.rank
                && candidateId.equals(that.candidateId)
                && internship.getId().equals(that.internship.getId())
                && breakdown.equals(that.breakdown)
                && reasons.equals(that.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateId, internship.getId(), overallScore, breakdown, reasons, rank);
    }

    @Override
    public String toString() {
        return String.format("Recommendation{rank=%d, candidate='%s', internship='%s', overall=%.3f, %s}",
                rank, candidateId, internship.getId(), overallScore, breakdown);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Recommendation.
     */
    public static final class Builder {
        private String candidateId;
        private Internship internship;
        private double overallScore;
        private ScoreBreakdown breakdown;
        private List<String> reasons;
        private int rank;

        public Builder candidateId(String candidateId) {
            this.candidateId = candidateId;
            return this;
        }

        public Builder internship(Internship internship) {
            this.internship = internship;
            return this;
        }

        public Builder overallScore(double overallScore) {
            this.overallScore = overallScore;
            return this;
        }

        public Builder breakdown(ScoreBreakdown breakdown) {
            this.breakdown = breakdown;
            return this;
        }

        public Builder reasons(List<String> reasons) {
            this.reasons = reasons;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }
}
