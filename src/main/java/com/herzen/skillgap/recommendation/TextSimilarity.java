package com.herzen.skillgap.recommendation;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

final class TextSimilarity {
    static final double THRESHOLD = 0.5;

    private TextSimilarity() {
    }

    static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    /** Jaccard index of the whitespace token sets, case-folded. */
    static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return intersection.size() / (double) union.size();
    }

    /**
     * Free-text skill match: token overlap above the threshold, or one string contained in the other.
     */
    static boolean similar(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) return false;
        return left.contains(right) || right.contains(left) || jaccard(left, right) > THRESHOLD;
    }

    private static Set<String> tokens(String s) {
        String n = normalize(s);
        if (n.isEmpty()) return Set.of();
        return Arrays.stream(n.split("\\s+")).filter(t -> !t.isEmpty()).collect(Collectors.toSet());
    }
}
