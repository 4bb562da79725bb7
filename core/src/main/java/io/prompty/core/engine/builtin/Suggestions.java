package io.prompty.core.engine.builtin;

import java.util.Comparator;
import java.util.List;

/** Builds "did you mean" hints for names that could not be found. */
final class Suggestions {

    private static final int MAX_LISTED = 10;

    private Suggestions() {}

    /**
     * Describes a missing name: the closest candidates by edit distance when any are close, else
     * the available candidates.
     */
    static String describeMissing(String what, String name, List<String> candidates) {
        String base = what + " not found: " + name;
        if (candidates.isEmpty()) {
            return base;
        }
        int threshold = Math.max(2, name.length() / 3);
        List<String> close = candidates.stream()
                .filter(c -> distance(name, c) <= threshold)
                .sorted(Comparator.comparingInt((String c) -> distance(name, c)).thenComparing(c -> c))
                .limit(3)
                .toList();
        if (!close.isEmpty()) {
            return base + " (did you mean: " + String.join(", ", close) + "?)";
        }
        List<String> listed = candidates.stream().limit(MAX_LISTED).toList();
        String more = candidates.size() > MAX_LISTED ? ", ..." : "";
        return base + " (available: " + String.join(", ", listed) + more + ")";
    }

    /** Levenshtein distance. */
    static int distance(String a, String b) {
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
