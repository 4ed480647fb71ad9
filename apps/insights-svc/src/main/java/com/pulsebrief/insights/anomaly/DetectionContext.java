package com.pulsebrief.insights.anomaly;

import java.time.Instant;

/**
 * Everything a detector may look at for one target point: the series (history is every
 * value before {@code targetIndex}), an optional cross-KPI snapshot, the population prior
 * used when history is short, and the run clock.
 */
public record DetectionContext(
        String tenantId,
        PreparedSeries series,
        int targetIndex,
        CrossKpiSnapshot snapshot,
        double populationPriorCv,
        Instant asOf
) {

    public DetectionContext {
        if (targetIndex < 1 || targetIndex >= series.length()) {
            throw new IllegalArgumentException("targetIndex out of range: " + targetIndex);
        }
        snapshot = snapshot != null ? snapshot : CrossKpiSnapshot.empty();
    }

    public double actual() {
        return series.valueAt(targetIndex);
    }

    public Instant targetTimestamp() {
        return series.timestampAt(targetIndex);
    }

    public double[] history() {
        return series.history(targetIndex);
    }
}
