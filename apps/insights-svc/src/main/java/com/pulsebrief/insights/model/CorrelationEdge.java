package com.pulsebrief.insights.model;

/**
 * Directed dependency: {@code sourceKpi} at time t relates to {@code targetKpi} at
 * t + lag. {@code strength} is the cross-correlation at that lag, {@code pValue} the
 * lagged-causality test result.
 */
public record CorrelationEdge(
        String sourceKpi,
        String targetKpi,
        int lag,
        double strength,
        double pearson,
        double spearman,
        double pValue,
        boolean causal
) {

    public CorrelationEdge {
        if (sourceKpi == null || targetKpi == null) {
            throw new IllegalArgumentException("edge endpoints must be provided");
        }
        if (sourceKpi.equals(targetKpi)) {
            throw new IllegalArgumentException("self-loop on " + sourceKpi);
        }
        if (lag < 0) {
            throw new IllegalArgumentException("lag must be non-negative: " + lag);
        }
        if (strength < -1d || strength > 1d) {
            throw new IllegalArgumentException("strength must be within [-1,1]: " + strength);
        }
    }
}
