package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.SamplingFrequency;
import java.time.Instant;
import java.util.Arrays;

/**
 * A KPI series regularised onto its sampling grid. Arrays are index-aligned;
 * {@code imputed[i]} marks values produced by gap filling.
 */
public record PreparedSeries(
        String kpiName,
        SamplingFrequency frequency,
        Instant origin,
        double[] values,
        boolean[] imputed,
        boolean stale,
        boolean truncated
) {

    public int length() {
        return values.length;
    }

    public Instant timestampAt(int index) {
        return origin.plus(frequency.step().multipliedBy(index));
    }

    public Instant lastTimestamp() {
        return timestampAt(values.length - 1);
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double lastValue() {
        return values[values.length - 1];
    }

    /** Values strictly before {@code index}. */
    public double[] history(int index) {
        return Arrays.copyOfRange(values, 0, index);
    }

    /** The last {@code count} values strictly before {@code index}. */
    public double[] trailing(int index, int count) {
        return Arrays.copyOfRange(values, Math.max(0, index - count), index);
    }

    public int imputedCount() {
        int count = 0;
        for (boolean flag : imputed) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    /**
     * Grid index of {@code timestamp}, or -1 when it falls outside the series.
     */
    public int indexOf(Instant timestamp) {
        long stepSeconds = frequency.step().getSeconds();
        long offset = timestamp.getEpochSecond() - origin.getEpochSecond();
        long index = Math.round((double) offset / stepSeconds);
        return index < 0 || index >= values.length ? -1 : (int) index;
    }

    /** Confidence multiplier for a point given imputation and staleness. */
    public double qualityFactor(int index) {
        double factor = imputed[index] ? 0.6d : 1d;
        return stale ? factor * 0.5d : factor;
    }
}
