package com.orderline.resolution.similarity;

/**
 * Sound-or-spelling similarity for misspelt product names: the edit-distance ratio, raised
 * to {@link #SOUNDEX_AGREEMENT} when both strings share a Soundex code.
 */
public class PhoneticSimilarity implements SimilarityAlgorithm {

    public static final double SOUNDEX_AGREEMENT = 0.8;

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        double edit = levenshtein.compute(s1, s2);
        double sound = SoundexEncoder.soundsAlike(s1, s2) ? SOUNDEX_AGREEMENT : 0.0;
        return Math.max(edit, sound);
    }

    @Override
    public String getName() {
        return "phonetic";
    }
}
