package com.identity.resolution.similarity;

/**
 * Normalized Levenshtein similarity: {@code 1 - distance / max(len1, len2)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int longest = Math.max(s1.length(), s2.length());
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 1.0 - ((double) distance(s1, s2) / longest);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Edit distance with unit costs for insertion, deletion and substitution.
     * Two-row dynamic programme, memory proportional to the shorter string.
     */
    public static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            curr[0] = j;
            char lc = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = prev[i - 1] + (shorter.charAt(i - 1) == lc ? 0 : 1);
                int insertion = curr[i - 1] + 1;
                int deletion = prev[i] + 1;
                curr[i] = Math.min(substitution, Math.min(insertion, deletion));
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
