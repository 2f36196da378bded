package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Education hierarchy, declared in ascending order.
 * Diploma &lt; Bachelor &lt; Master &lt; PhD.
 */
public enum EducationLevel {
    DIPLOMA("Diploma"),
    BACHELOR("Bachelor"),
    MASTER("Master"),
    PHD("PhD");

    private final String label;

    EducationLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAbove(EducationLevel other) {
        return compareTo(other) > 0;
    }

    public boolean isBelow(EducationLevel other) {
        return compareTo(other) < 0;
    }

    /**
     * Parse a level from its label or enum name, ignoring case.
     *
     * @throws ValidationException if the value is blank or not a known level
     */
    public static EducationLevel parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException("education_level is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EducationLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new ValidationException("Unknown education_level: " + value);
    }
}
