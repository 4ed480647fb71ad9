package com.pulsebrief.insights.model;

/**
 * Cohen's d buckets.
 */
public enum EffectSize {
    NEGLIGIBLE,
    SMALL,
    MEDIUM,
    LARGE;

    public static EffectSize fromCohensD(double d) {
        double abs = Math.abs(d);
        if (abs < 0.2d) {
            return NEGLIGIBLE;
        }
        if (abs < 0.5d) {
            return SMALL;
        }
        if (abs < 0.8d) {
            return MEDIUM;
        }
        return LARGE;
    }
}
