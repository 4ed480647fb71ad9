package com.pulsebrief.insights.error;

/**
 * Raised when a forecasting model cannot be fitted (too little history, degenerate
 * numerics). Detection falls back to the simpler tiers.
 */
public class ModelFitException extends InsightsException {

    public ModelFitException(String kpiName, String message) {
        super(kpiName, message);
    }

    public ModelFitException(String kpiName, String message, Throwable cause) {
        super(kpiName, message, cause);
    }
}
