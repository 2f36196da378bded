package org.internmatch.engine.domain.scoring;

import org.internmatch.engine.domain.model.Terms;

/**
 * Fuzzy similarity between two skill names, in [0, 1].
 *
 * <p>Both inputs are normalized first. The similarity is the larger of:
 * <ul>
 *   <li>the Levenshtein ratio {@code 1 - distance / max(len(a), len(b))}</li>
 *   <li>the containment ratio {@code len(shorter) / len(longer)} when the longer string
 *       contains the shorter one, else 0</li>
 * </ul>
 * Equal strings score 1.0; a blank input scores 0.0.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static double similarity(String a, String b) {
        String left = Terms.normalize(a);
        String right = Terms.normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        return Math.max(levenshteinRatio(left, right), containmentRatio(left, right));
    }

    static double levenshteinRatio(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLength;
    }

    static double containmentRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        if (!longer.contains(shorter)) {
            return 0.0;
        }
        return (double) shorter.length() / longer.length();
    }

    /**
     * Classic edit distance with unit costs, two-row dynamic programming.
     */
    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
