package com.pulsebrief.insights.anomaly;

import java.time.Duration;
import java.time.Instant;

/**
 * Additive linear-trend plus seasonal-index model. Time is measured in grid steps from
 * {@code origin} so forecasts stay valid as the series grows.
 */
public record SeasonalModel(
        Instant origin,
        Duration step,
        double intercept,
        double slope,
        double[] seasonalIndices,
        double residualStd,
        int fittedPoints,
        Instant fittedThrough,
        Instant fittedAt
) {

    static final double INTERVAL_Z = 1.96d;

    public double forecast(Instant timestamp) {
        long t = stepsFromOrigin(timestamp);
        int period = seasonalIndices.length;
        return intercept + slope * t + seasonalIndices[(int) Math.floorMod(t, (long) period)];
    }

    public double intervalHalfWidth() {
        return INTERVAL_Z * residualStd * Math.sqrt(1d + 1d / fittedPoints);
    }

    public int period() {
        return seasonalIndices.length;
    }

    long stepsFromOrigin(Instant timestamp) {
        return Math.round((double) (timestamp.getEpochSecond() - origin.getEpochSecond()) / step.getSeconds());
    }
}
