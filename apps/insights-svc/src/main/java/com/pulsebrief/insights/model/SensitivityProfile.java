package com.pulsebrief.insights.model;

/**
 * Alert sensitivity chosen by the founder; {@link #CUSTOM} uses the founder's own
 * threshold.
 */
public enum SensitivityProfile {
    CONSERVATIVE(0.6d),
    BALANCED(0.5d),
    AGGRESSIVE(0.4d),
    CUSTOM(0.5d);

    private final double baseThreshold;

    SensitivityProfile(double baseThreshold) {
        this.baseThreshold = baseThreshold;
    }

    public double baseThreshold() {
        return baseThreshold;
    }
}
