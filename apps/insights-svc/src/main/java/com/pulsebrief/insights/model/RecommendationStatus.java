package com.pulsebrief.insights.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a recommendation. Only a pending recommendation can move, and it moves
 * exactly once.
 */
public enum RecommendationStatus {
    PENDING,
    ACCEPTED,
    SCHEDULED,
    DISMISSED,
    EXPIRED;

    private static final Set<RecommendationStatus> FROM_PENDING = EnumSet.of(ACCEPTED, SCHEDULED, DISMISSED, EXPIRED);

    public boolean canTransitionTo(RecommendationStatus target) {
        return this == PENDING && FROM_PENDING.contains(target);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
