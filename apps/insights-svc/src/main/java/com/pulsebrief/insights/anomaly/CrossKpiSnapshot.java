package com.pulsebrief.insights.anomaly;

import java.time.Instant;
import java.util.Map;

/**
 * Robust z-scores of every KPI in the run, keyed by timestamp then KPI. Lets a detector
 * see whether the rest of the business moved at the same time.
 */
public record CrossKpiSnapshot(Map<Instant, Map<String, Double>> robustZ) {

    public static CrossKpiSnapshot empty() {
        return new CrossKpiSnapshot(Map.of());
    }

    public boolean isEmpty() {
        return robustZ.isEmpty();
    }

    /** Mean absolute z of the other KPIs at {@code timestamp}, 0 when none reported. */
    public double peerDeviation(Instant timestamp, String excludeKpi) {
        Map<String, Double> atTime = robustZ.get(timestamp);
        if (atTime == null) {
            return 0d;
        }
        double sum = 0d;
        int count = 0;
        for (Map.Entry<String, Double> entry : atTime.entrySet()) {
            if (!entry.getKey().equals(excludeKpi)) {
                sum += Math.abs(entry.getValue());
                count++;
            }
        }
        return count == 0 ? 0d : sum / count;
    }
}
