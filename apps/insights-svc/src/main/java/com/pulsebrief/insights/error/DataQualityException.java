package com.pulsebrief.insights.error;

/**
 * Missing, stale or unusable series data. The affected KPI is reported with reduced
 * certainty; values are never fabricated to hide the gap.
 */
public class DataQualityException extends InsightsException {

    public DataQualityException(String kpiName, String message) {
        super(kpiName, message);
    }
}
