package com.pulsebrief.insights.recommendation;

/**
 * Operational signals that adjust candidate inputs: the number of overdue open tasks and
 * the mean message sentiment in [-1, 1].
 */
public record RecommendationSignals(int overdueTasks, double sentiment) {

    public RecommendationSignals {
        if (overdueTasks < 0) {
            throw new IllegalArgumentException("overdueTasks must not be negative");
        }
        if (sentiment < -1d || sentiment > 1d) {
            throw new IllegalArgumentException("sentiment must be within [-1,1]");
        }
    }

    public static RecommendationSignals neutral() {
        return new RecommendationSignals(0, 0d);
    }
}
