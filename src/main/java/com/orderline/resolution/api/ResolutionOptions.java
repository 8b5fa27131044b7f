package com.orderline.resolution.api;

import com.orderline.resolution.scoring.ScoringWeights;

/**
 * Options for order-line resolution.
 * Configures tier thresholds, the suggestion cap, unattended automation and scoring weights.
 */
public class ResolutionOptions {

    private static final double DEFAULT_AUTO_THRESHOLD = 50.0;
    private static final double DEFAULT_TOP_SUGGESTION_THRESHOLD = 25.0;
    private static final double DEFAULT_SUGGESTION_LIST_THRESHOLD = 10.0;
    private static final int DEFAULT_MAX_SUGGESTIONS = 20;
    private static final int DEFAULT_MAX_MESSAGE_LINES = 500;
    private static final long DEFAULT_PENDING_RESULT_TTL_SECONDS = 3600;

    private final double autoThreshold;
    private final double topSuggestionThreshold;
    private final double suggestionListThreshold;
    private final int maxSuggestions;
    private final boolean allowUnattendedTopSuggestion;
    private final boolean allowShortfall;
    private final boolean flagUnavailableSuggestions;
    private final ScoringWeights scoringWeights;
    private final String sourceSystem;
    private final int maxMessageLines;
    private final long pendingResultTtlSeconds;

    private ResolutionOptions(Builder builder) {
        this.autoThreshold = builder.autoThreshold;
        this.topSuggestionThreshold = builder.topSuggestionThreshold;
        this.suggestionListThreshold = builder.suggestionListThreshold;
        this.maxSuggestions = builder.maxSuggestions;
        this.allowUnattendedTopSuggestion = builder.allowUnattendedTopSuggestion;
        this.allowShortfall = builder.allowShortfall;
        this.flagUnavailableSuggestions = builder.flagUnavailableSuggestions;
        this.scoringWeights = builder.scoringWeights;
        this.sourceSystem = builder.sourceSystem;
        this.maxMessageLines = builder.maxMessageLines;
        this.pendingResultTtlSeconds = builder.pendingResultTtlSeconds;
    }

    public double getAutoThreshold() {
        return autoThreshold;
    }

    public double getTopSuggestionThreshold() {
        return topSuggestionThreshold;
    }

    public double getSuggestionListThreshold() {
        return suggestionListThreshold;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    /**
     * Whether TOP_SUGGESTION lines may be confirmed without a human, e.g. when reprocessing
     * historical invoices. Off by default.
     */
    public boolean isAllowUnattendedTopSuggestion() {
        return allowUnattendedTopSuggestion;
    }

    /**
     * Whether a reservation may cover only part of the request and hand the rest to
     * procurement. When false, a product without any reservable stock is rejected.
     */
    public boolean isAllowShortfall() {
        return allowShortfall;
    }

    public boolean isFlagUnavailableSuggestions() {
        return flagUnavailableSuggestions;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public int getMaxMessageLines() {
        return maxMessageLines;
    }

    public long getPendingResultTtlSeconds() {
        return pendingResultTtlSeconds;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Unattended batch processing: TOP_SUGGESTION lines are applied without confirmation.
     */
    public static ResolutionOptions unattended() {
        return builder()
                .allowUnattendedTopSuggestion(true)
                .sourceSystem("BATCH")
                .build();
    }

    /**
     * Higher thresholds; fewer lines resolve without a human.
     */
    public static ResolutionOptions conservative() {
        return builder()
                .autoThreshold(70.0)
                .topSuggestionThreshold(40.0)
                .suggestionListThreshold(15.0)
                .allowShortfall(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double autoThreshold = DEFAULT_AUTO_THRESHOLD;
        private double topSuggestionThreshold = DEFAULT_TOP_SUGGESTION_THRESHOLD;
        private double suggestionListThreshold = DEFAULT_SUGGESTION_LIST_THRESHOLD;
        private int maxSuggestions = DEFAULT_MAX_SUGGESTIONS;
        private boolean allowUnattendedTopSuggestion = false;
        private boolean allowShortfall = true;
        private boolean flagUnavailableSuggestions = true;
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private String sourceSystem = "SYSTEM";
        private int maxMessageLines = DEFAULT_MAX_MESSAGE_LINES;
        private long pendingResultTtlSeconds = DEFAULT_PENDING_RESULT_TTL_SECONDS;

        public Builder autoThreshold(double autoThreshold) {
            validateThreshold(autoThreshold, "autoThreshold");
            this.autoThreshold = autoThreshold;
            return this;
        }

        public Builder topSuggestionThreshold(double topSuggestionThreshold) {
            validateThreshold(topSuggestionThreshold, "topSuggestionThreshold");
            this.topSuggestionThreshold = topSuggestionThreshold;
            return this;
        }

        public Builder suggestionListThreshold(double suggestionListThreshold) {
            validateThreshold(suggestionListThreshold, "suggestionListThreshold");
            this.suggestionListThreshold = suggestionListThreshold;
            return this;
        }

        public Builder maxSuggestions(int maxSuggestions) {
            if (maxSuggestions <= 0) {
                throw new IllegalArgumentException("maxSuggestions must be positive");
            }
            this.maxSuggestions = maxSuggestions;
            return this;
        }

        public Builder allowUnattendedTopSuggestion(boolean allowUnattendedTopSuggestion) {
            this.allowUnattendedTopSuggestion = allowUnattendedTopSuggestion;
            return this;
        }

        public Builder allowShortfall(boolean allowShortfall) {
            this.allowShortfall = allowShortfall;
            return this;
        }

        public Builder flagUnavailableSuggestions(boolean flagUnavailableSuggestions) {
            this.flagUnavailableSuggestions = flagUnavailableSuggestions;
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder maxMessageLines(int maxMessageLines) {
            if (maxMessageLines <= 0) {
                throw new IllegalArgumentException("maxMessageLines must be positive");
            }
            this.maxMessageLines = maxMessageLines;
            return this;
        }

        public Builder pendingResultTtlSeconds(long pendingResultTtlSeconds) {
            if (pendingResultTtlSeconds <= 0) {
                throw new IllegalArgumentException("pendingResultTtlSeconds must be positive");
            }
            this.pendingResultTtlSeconds = pendingResultTtlSeconds;
            return this;
        }

        public ResolutionOptions build() {
            if (autoThreshold < topSuggestionThreshold) {
                throw new IllegalArgumentException(
                        "autoThreshold must be >= topSuggestionThreshold");
            }
            if (topSuggestionThreshold < suggestionListThreshold) {
                throw new IllegalArgumentException(
                        "topSuggestionThreshold must be >= suggestionListThreshold");
            }
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights is required");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 100.0) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "autoThreshold=" + autoThreshold +
                ", topSuggestionThreshold=" + topSuggestionThreshold +
                ", suggestionListThreshold=" + suggestionListThreshold +
                ", maxSuggestions=" + maxSuggestions +
                ", allowUnattendedTopSuggestion=" + allowUnattendedTopSuggestion +
                ", allowShortfall=" + allowShortfall +
                ", sourceSystem='" + sourceSystem + '\'' +
                ", maxMessageLines=" + maxMessageLines +
                '}';
    }
}
