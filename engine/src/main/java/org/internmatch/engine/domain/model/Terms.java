package org.internmatch.engine.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalization of free-text terms such as skills and sectors.
 */
public final class Terms {

    private Terms() {
    }

    /**
     * Trim and lower-case a single term. Returns an empty string for null.
     */
    public static String normalize(String term) {
        if (term == null) {
            return "";
        }
        return term.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Normalize every term, dropping blanks and duplicates. Insertion order is kept.
     */
    public static Set<String> normalizeAll(Collection<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String term : terms) {
            String normalized = normalize(term);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
