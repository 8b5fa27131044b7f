package com.orderline.resolution.core.model;

/**
 * Automation-confidence bucket assigned to a resolved line.
 * Thresholds are configured through {@code ResolutionOptions}.
 */
public enum DecisionTier {
    /**
     * Score at or above the auto threshold (50 by default).
     * The line proceeds without confirmation.
     */
    AUTO,

    /**
     * Score between the top-suggestion and auto thresholds (25 to 50 by default).
     * The top candidate is proposed but must be confirmed.
     */
    TOP_SUGGESTION,

    /**
     * Score between the suggestion-list and top-suggestion thresholds (10 to 25 by default).
     * No best match; a ranked list is offered for a human to choose from.
     */
    SUGGESTION_LIST,

    /**
     * Nothing scored high enough. The caller falls back to manual creation or rejection.
     */
    NONE;

    /**
     * Tiers in which stock or pricing may not be mutated without an explicit human choice.
     */
    public boolean forbidsUnconfirmedMutation() {
        return this == SUGGESTION_LIST || this == NONE;
    }
}
