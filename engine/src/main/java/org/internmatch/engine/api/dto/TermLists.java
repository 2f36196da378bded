package org.internmatch.engine.api.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits term lists that may arrive either as JSON arrays or as comma-separated strings.
 */
final class TermLists {

    private TermLists() {
    }

    static List<String> split(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> terms = new ArrayList<>();
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                if (!part.trim().isEmpty()) {
                    terms.add(part.trim());
                }
            }
        }
        return terms;
    }
}
