package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.List;

/**
 * A flagged observation. {@code magnitude} is the relative deviation from the expected
 * value, signed; {@code score} is the combined detector score the severity came from.
 */
public record Anomaly(
        String id,
        String kpiName,
        Instant timestamp,
        double actualValue,
        double expectedValue,
        double magnitude,
        AnomalyDirection direction,
        Severity severity,
        double score,
        double confidence,
        List<DetectionMethod> contributingMethods,
        String explanation
) {

    public Anomaly {
        if (score < 0d || score > 1d) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        if (confidence < 0d || confidence > 1d) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        contributingMethods = contributingMethods == null ? List.of() : List.copyOf(contributingMethods);
    }
}
