package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable internship record. {@code capacity} is the number of open slots at load time;
 * the live remaining count is held by the capacity tracker.
 */
public final class Internship {

    private final String id;
    private final String title;
    private final String company;
    private final String sector;
    private final String location;
    private final Set<String> skillsRequired;
    private final EducationLevel educationLevel;
    private final int capacity;
    private final int durationMonths;
    private final int stipend;
    private final boolean ruralFriendly;
    private final boolean diversityFocused;

    private Internship(Builder builder) {
        this.id = requireText(builder.id, "id", builder.id);
        this.title = requireText(builder.title, "title", id);
        this.company = requireText(builder.company, "company", id);
        this.sector = requireText(builder.sector, "sector", id);
        this.location = requireText(builder.location, "location", id);
        if (builder.educationLevel == null) {
            throw new ValidationException("Internship " + id + ": education_level is required");
        }
        if (builder.capacity < 0) {
            throw new ValidationException("Internship " + id + ": capacity must not be negative");
        }
        if (builder.durationMonths < 0 || builder.stipend < 0) {
            throw new ValidationException("Internship " + id + ": duration and stipend must not be negative");
        }
        this.educationLevel = builder.educationLevel;
        this.skillsRequired = Terms.normalizeAll(builder.skillsRequired);
        this.capacity = builder.capacity;
        this.durationMonths = builder.durationMonths;
        this.stipend = builder.stipend;
        this.ruralFriendly = builder.ruralFriendly;
        this.diversityFocused = builder.diversityFocused;
    }

    private static String requireText(String value, String field, String id) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException("Internship " + (id != null ? id + ": " : "") + field + " is required");
        }
        return value.trim();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getCompany() {
        return company;
    }

    public String getSector() {
        return sector;
    }

    public String getLocation() {
        return location;
    }

    public Set<String> getSkillsRequired() {
        return skillsRequired;
    }

    public EducationLevel getEducationLevel() {
        return educationLevel;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getDurationMonths() {
        return durationMonths;
    }

    public int getStipend() {
        return stipend;
    }

    public boolean isRuralFriendly() {
        return ruralFriendly;
    }

    public boolean isDiversityFocused() {
        return diversityFocused;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Internship)) {
            return false;
        }
        return id.equals(((Internship) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Internship{id='%s', title='%s', company='%s', capacity=%d}",
                id, title, company, capacity);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Internship.
     */
    public static final class Builder {
        private String id;
        private String title;
        private String company;
        private String sector;
        private String location;
        private Collection<String> skillsRequired;
        private EducationLevel educationLevel;
        private int capacity;
        private int durationMonths;
        private int stipend;
        private boolean ruralFriendly;
        private boolean diversityFocused;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder sector(String sector) {
            this.sector = sector;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder skillsRequired(Collection<String> skillsRequired) {
            this.skillsRequired = skillsRequired;
            return this;
        }

        public Builder educationLevel(EducationLevel educationLevel) {
            this.educationLevel = educationLevel;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder durationMonths(int durationMonths) {
            this.durationMonths = durationMonths;
            return this;
        }

        public Builder stipend(int stipend) {
            this.stipend = stipend;
            return this;
        }

        public Builder ruralFriendly(boolean ruralFriendly) {
            this.ruralFriendly = ruralFriendly;
            return this;
        }

        public Builder diversityFocused(boolean diversityFocused) {
            this.diversityFocused = diversityFocused;
            return this;
        }

        public Internship build() {
            return new Internship(this);
        }
    }
}
