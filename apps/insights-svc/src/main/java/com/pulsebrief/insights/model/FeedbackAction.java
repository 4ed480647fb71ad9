package com.pulsebrief.insights.model;

/**
 * Founder reaction to a recommendation, anomaly or briefing item.
 */
public enum FeedbackAction {
    ACCEPTED,
    SCHEDULED,
    DISMISSED,
    IGNORED;

    public boolean isPositive() {
        return this == ACCEPTED || this == SCHEDULED;
    }
}
