package com.pulsebrief.insights.model;

import java.time.Duration;

/**
 * Grid a KPI is sampled on, with the seasonal period used for that grid.
 */
public enum SamplingFrequency {
    DAILY(Duration.ofDays(1), 7),
    WEEKLY(Duration.ofDays(7), 4),
    MONTHLY(Duration.ofSeconds(2_629_746L), 12);

    private final Duration step;
    private final int seasonalPeriod;

    SamplingFrequency(Duration step, int seasonalPeriod) {
        this.step = step;
        this.seasonalPeriod = seasonalPeriod;
    }

    public Duration step() {
        return step;
    }

    public int seasonalPeriod() {
        return seasonalPeriod;
    }

    /** Number of grid points covering {@code days}, at least one. */
    public int pointsFor(int days) {
        long seconds = Duration.ofDays(days).getSeconds();
        return (int) Math.max(1L, Math.round((double) seconds / step.getSeconds()));
    }
}
