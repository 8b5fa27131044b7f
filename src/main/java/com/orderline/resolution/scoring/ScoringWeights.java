package com.orderline.resolution.scoring;

/**
 * Point values of the match strategies. All values are configuration, validated against
 * a labelled corpus of real order lines rather than derived.
 *
 * @param exactNameMatch        points when the product phrase equals the candidate's core name
 * @param wordOverlapMax        points when every product word appears in the candidate name
 * @param unitMatch             points when the candidate unit equals the parsed unit
 * @param compatibleUnitFactor  share of {@code unitMatch} for a compatible unit or a descriptor naming it
 * @param descriptorMatch       points per descriptor token found in the candidate's descriptors
 * @param descriptorMax         cap for the descriptor points
 * @param aliasMatch            points when an alias maps onto the candidate's core name
 * @param phoneticMax           points for a perfect phonetic similarity
 * @param phoneticMinSimilarity similarity at or below which the phonetic fallback scores nothing
 */
public record ScoringWeights(
        double exactNameMatch,
        double wordOverlapMax,
        double unitMatch,
        double compatibleUnitFactor,
        double descriptorMatch,
        double descriptorMax,
        double aliasMatch,
        double phoneticMax,
        double phoneticMinSimilarity
) {
    public ScoringWeights {
        if (exactNameMatch < 0 || wordOverlapMax < 0 || unitMatch < 0 || descriptorMatch < 0
                || descriptorMax < 0 || aliasMatch < 0 || phoneticMax < 0) {
            throw new IllegalArgumentException("Strategy points must be non-negative");
        }
        if (compatibleUnitFactor < 0.0 || compatibleUnitFactor > 1.0) {
            throw new IllegalArgumentException("compatibleUnitFactor must be between 0.0 and 1.0, got " + compatibleUnitFactor);
        }
        if (phoneticMinSimilarity < 0.0 || phoneticMinSimilarity > 1.0) {
            throw new IllegalArgumentException("phoneticMinSimilarity must be between 0.0 and 1.0, got " + phoneticMinSimilarity);
        }
        if (descriptorMax < descriptorMatch) {
            throw new IllegalArgumentException("descriptorMax must be >= descriptorMatch");
        }
    }

    /**
     * Low end of each documented point range.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(45.0, 25.0, 15.0, 0.7, 15.0, 30.0, 20.0, 20.0, 0.3);
    }

    /**
     * High end of each documented point range; lines reach the auto tier more easily.
     */
    public static ScoringWeights generous() {
        return new ScoringWeights(50.0, 30.0, 20.0, 0.7, 20.0, 40.0, 25.0, 20.0, 0.3);
    }
}
