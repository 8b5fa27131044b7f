package com.orderline.resolution.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard overlap of the distinct characters of two strings, whitespace ignored.
 * Coarse on purpose: it only screens phonetic fallback candidates.
 */
public class CharacterJaccardSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<Character> chars1 = characters(s1);
        Set<Character> chars2 = characters(s2);
        if (chars1.isEmpty() && chars2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (Character c : chars1) {
            if (chars2.contains(c)) {
                intersectionSize++;
            }
        }
        int unionSize = chars1.size() + chars2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "character-jaccard";
    }

    private static Set<Character> characters(String s) {
        Set<Character> result = new HashSet<>();
        for (char c : s.toLowerCase(Locale.ROOT).toCharArray()) {
            if (!Character.isWhitespace(c)) {
                result.add(c);
            }
        }
        return result;
    }
}
