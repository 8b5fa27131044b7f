package com.orderline.resolution.similarity;

/**
 * Edit-distance ratio: {@code 1 - distance / max(length)}.
 * "brocoli" against "broccoli" is one insertion over eight characters, 0.875.
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
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Wagner-Fischer edit distance keeping two rows of the shorter string's length.
     */
    public static int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int m = shorter.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            currentRow[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = shorter.charAt(i - 1) == c ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost);
            }
            int[] swap = previousRow;
            previousRow = currentRow;
            currentRow = swap;
        }
        return previousRow[m];
    }
}
