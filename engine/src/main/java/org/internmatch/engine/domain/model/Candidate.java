package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable candidate profile. Skills and sector interests are normalized at construction.
 */
public final class Candidate {

    private final String id;
    private final String name;
    private final EducationLevel educationLevel;
    private final Set<String> skills;
    private final String location;
    private final Set<String> sectorInterests;
    private final SocialCategory socialCategory;
    private final boolean fromRuralArea;
    private final boolean prefersRural;
    private final boolean firstGenerationGraduate;

    private Candidate(Builder builder) {
        this.id = requireText(builder.id, "id");
        this.name = requireText(builder.name, "name");
        if (builder.educationLevel == null) {
            throw new ValidationException("Candidate " + id + ": education_level is required");
        }
        this.educationLevel = builder.educationLevel;
        this.location = requireText(builder.location, "location");
        this.skills = Terms.normalizeAll(builder.skills);
        this.sectorInterests = Terms.normalizeAll(builder.sectorInterests);
        this.socialCategory = builder.socialCategory != null ? builder.socialCategory : SocialCategory.GENERAL;
        this.fromRuralArea = builder.fromRuralArea;
        this.prefersRural = builder.prefersRural;
        this.firstGenerationGraduate = builder.firstGenerationGraduate;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException("Candidate " + field + " is required");
        }
        return value.trim();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EducationLevel getEducationLevel() {
        return educationLevel;
    }

    public Set<String> getSkills() {
        return skills;
    }

    public String getLocation() {
        return location;
    }

    public Set<String> getSectorInterests() {
        return sectorInterests;
    }

    public SocialCategory getSocialCategory() {
        return socialCategory;
    }

    public boolean isFromRuralArea() {
        return fromRuralArea;
    }

    public boolean isPrefersRural() {
        return prefersRural;
    }

    public boolean isFirstGenerationGraduate() {
        return firstGenerationGraduate;
    }

    /**
     * True if any affirmative-action attribute applies to this candidate.
     */
    public boolean isDiversityCandidate() {
        return fromRuralArea || socialCategory.isReserved() || firstGenerationGraduate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Candidate)) {
            return false;
        }
        return id.equals(((Candidate) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Candidate{id='%s', education=%s, location='%s', skills=%s}",
                id, educationLevel, location, skills);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Candidate.
     */
    public static final class Builder {
        private String id;
        private String name;
        private EducationLevel educationLevel;
        private Collection<String> skills;
        private String location;
        private Collection<String> sectorInterests;
        private SocialCategory socialCategory;
        private boolean fromRuralArea;
        private boolean prefersRural;
        private boolean firstGenerationGraduate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder educationLevel(EducationLevel educationLevel) {
            this.educationLevel = educationLevel;
            return this;
        }

        public Builder skills(Collection<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder sectorInterests(Collection<String> sectorInterests) {
            this.sectorInterests = sectorInterests;
            return this;
        }

        public Builder socialCategory(SocialCategory socialCategory) {
            this.socialCategory = socialCategory;
            return this;
        }

        public Builder fromRuralArea(boolean fromRuralArea) {
            this.fromRuralArea = fromRuralArea;
            return this;
        }

        public Builder prefersRural(boolean prefersRural) {
            this.prefersRural = prefersRural;
            return this;
        }

        public Builder firstGenerationGraduate(boolean firstGenerationGraduate) {
            this.firstGenerationGraduate = firstGenerationGraduate;
            return this;
        }

        public Candidate build() {
            return new Candidate(this);
        }
    }
}
