package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.FeedbackAction;

/**
 * Learned offset on the detection threshold for one (tenant, KPI). Positive offsets make
 * the KPI quieter.
 */
public record ThresholdState(double offset, int confirmations, int dismissals) {

    public static final ThresholdState NEUTRAL = new ThresholdState(0d, 0, 0);

    /**
     * Bounded-step update: confirmed anomalies lower the threshold by {@code step},
     * dismissed or ignored ones raise it, always within [-maxOffset, maxOffset].
     */
    public ThresholdState apply(FeedbackAction action, double step, double maxOffset) {
        if (action.isPositive()) {
            return new ThresholdState(clamp(offset - step, maxOffset), confirmations + 1, dismissals);
        }
        return new ThresholdState(clamp(offset + step, maxOffset), confirmations, dismissals + 1);
    }

    private static double clamp(double value, double maxOffset) {
        return Math.max(-maxOffset, Math.min(maxOffset, value));
    }
}
