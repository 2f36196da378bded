package org.internmatch.engine.domain.model;

import org.internmatch.engine.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Social category of a candidate. SC, ST and OBC are reserved categories.
 */
public enum SocialCategory {
    GENERAL,
    SC,
    ST,
    OBC;

    public boolean isReserved() {
        return this != GENERAL;
    }

    /**
     * Parse a category ignoring case. A missing or blank value means the candidate
     * did not state one and maps to GENERAL.
     *
     * @throws ValidationException for any other unknown value
     */
    public static SocialCategory parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return GENERAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown social_category: " + value, e);
        }
    }
}
