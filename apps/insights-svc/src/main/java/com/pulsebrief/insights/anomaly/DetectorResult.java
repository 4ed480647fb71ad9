package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.DetectionMethod;

/**
 * Output of one tier. {@code score} in [0,1], 0.5 marks the tier's own decision
 * boundary. Inapplicable tiers are dropped and the remaining weights renormalised.
 */
public record DetectorResult(
        DetectionMethod method,
        boolean applicable,
        double score,
        Double expected,
        Double lower,
        Double upper,
        String note
) {

    public DetectorResult {
        if (score < 0d || score > 1d) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
    }

    public static DetectorResult notApplicable(DetectionMethod method, String reason) {
        return new DetectorResult(method, false, 0d, null, null, null, reason);
    }

    public boolean flags() {
        return applicable && score >= 0.5d;
    }
}
