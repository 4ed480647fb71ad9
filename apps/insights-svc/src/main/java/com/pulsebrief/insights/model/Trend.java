package com.pulsebrief.insights.model;

/**
 * Result of comparing the current window of a KPI with the window before it.
 * Nullable fields are only populated for the horizons they apply to: {@code slope} and
 * {@code rSquared} for medium-term windows, {@code periodGrowth} and
 * {@code compoundMonthlyRate} for long-term ones.
 */
public record Trend(
        String kpiName,
        Timeframe timeframe,
        TrendDirection direction,
        double magnitude,
        double absoluteChange,
        double currentMean,
        double priorMean,
        double pValue,
        boolean significant,
        EffectSize effectSize,
        double cohensD,
        Acceleration acceleration,
        Double slope,
        Double rSquared,
        Double periodGrowth,
        Double compoundMonthlyRate,
        boolean indeterminate,
        double confidence,
        String method
) {

    public Trend {
        if (confidence < 0d || confidence > 1d) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public static Trend indeterminate(String kpiName, Timeframe timeframe, String method) {
        return new Trend(kpiName, timeframe, TrendDirection.FLAT, 0d, 0d, 0d, 0d, 1d, false,
                EffectSize.NEGLIGIBLE, 0d, Acceleration.STEADY, null, null, null, null, true, 0d, method);
    }
}
