package com.github.salilvnair.entityflow.engine.ranking;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Composite string similarity on a 0..100 scale. The score is the best of several
 * measures so that one strong signal (containment, shared words) is enough.
 */
@Component
public class SimilarityScorer {

    public static final int EXACT = 100;
    public static final int CASE_INSENSITIVE = 95;
    public static final int CONTAINED = 85;

    public int calculate(String identifier, String candidate) {
        if (identifier == null || candidate == null) {
            return 0;
        }
        String a = identifier.trim();
        String b = candidate.trim();
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        if (a.equals(b)) {
            return EXACT;
        }
        if (a.equalsIgnoreCase(b)) {
            return CASE_INSENSITIVE;
        }
        String lowerA = a.toLowerCase(Locale.ROOT);
        String lowerB = b.toLowerCase(Locale.ROOT);
        if (lowerB.contains(lowerA)) {
            return CONTAINED;
        }
        double best = Math.max(levenshteinSimilarity(lowerA, lowerB), characterOverlap(lowerA, lowerB));
        best = Math.max(best, wordOverlap(lowerA, lowerB));
        return clamp((int) Math.round(best));
    }

    /** {@code (1 - distance / maxLen) * 100}. */
    double levenshteinSimilarity(String a, String b) {
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 100d;
        }
        return (1d - (double) levenshtein(a, b) / maxLen) * 100d;
    }

    int levenshtein(String a, String b) {
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

    /**
     * Shared characters as found by repeatedly taking the longest common substring and
     * recursing on both sides of it, as a percentage of the combined length.
     */
    double characterOverlap(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 0d;
        }
        return commonCharacters(a, b) * 2d * 100d / total;
    }

    private int commonCharacters(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int bestLength = 0;
        int bestA = 0;
        int bestB = 0;
        for (int i = 0; i < a.length(); i++) {
            for (int j = 0; j < b.length(); j++) {
                int k = 0;
                while (i + k < a.length() && j + k < b.length() && a.charAt(i + k) == b.charAt(j + k)) {
                    k++;
                }
                if (k > bestLength) {
                    bestLength = k;
                    bestA = i;
                    bestB = j;
                }
            }
        }
        if (bestLength == 0) {
            return 0;
        }
        return bestLength
                + commonCharacters(a.substring(0, bestA), b.substring(0, bestB))
                + commonCharacters(a.substring(bestA + bestLength), b.substring(bestB + bestLength));
    }

    /** {@code |A ∩ B| / max(|A|, |B|) * 100} over whitespace-separated words. */
    double wordOverlap(String a, String b) {
        Set<String> wordsA = words(a);
        Set<String> wordsB = words(b);
        int max = Math.max(wordsA.size(), wordsB.size());
        if (max == 0) {
            return 0d;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        return (double) intersection.size() / max * 100d;
    }

    private Set<String> words(String text) {
        return Arrays.stream(text.split("\\s+"))
                .filter(w -> !w.isBlank())
                .collect(Collectors.toSet());
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
