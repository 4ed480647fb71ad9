package com.pulsebrief.insights.stats;

import java.util.Arrays;

/**
 * Descriptive statistics and correlation measures over primitive arrays.
 * Sample (n - 1) variance throughout.
 */
public final class Statistics {

    /** Scales MAD to a consistent estimator of the standard deviation for normal data. */
    public static final double MAD_TO_SIGMA = 1.4826d;

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length < 2) {
            return 0d;
        }
        double mean = mean(values);
        double sumSquares = 0d;
        for (double value : values) {
            double delta = value - mean;
            sumSquares += delta * delta;
        }
        return sumSquares / (values.length - 1);
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Coefficient of variation, or 0 when the mean is zero.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0d) {
            return 0d;
        }
        return stdDev(values) / Math.abs(mean);
    }

    public static double median(double[] values) {
        return percentile(values, 50d);
    }

    /**
     * Linear-interpolated percentile, {@code percentile} in [0, 100].
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0d;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double index = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /** Median absolute deviation around the median (unscaled). */
    public static double medianAbsoluteDeviation(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    public static double meanAbsoluteDeviation(double[] values) {
        double mean = mean(values);
        double sum = 0d;
        for (double value : values) {
            sum += Math.abs(value - mean);
        }
        return values.length == 0 ? 0d : sum / values.length;
    }

    /**
     * Pearson correlation; 0 when either side has no variance.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("series lengths differ: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            return 0d;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double covariance = 0d;
        double varX = 0d;
        double varY = 0d;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0d || varY == 0d) {
            return 0d;
        }
        return clamp(covariance / Math.sqrt(varX * varY), -1d, 1d);
    }

    public static double spearman(double[] x, double[] y) {
        return pearson(ranks(x), ranks(y));
    }

    /**
     * Correlation of {@code leader[t]} with {@code follower[t + lag]}; positive lag means the
     * leader moves first.
     */
    public static double laggedCorrelation(double[] leader, double[] follower, int lag) {
        if (lag < 0) {
            throw new IllegalArgumentException("lag must be non-negative");
        }
        int length = Math.min(leader.length, follower.length) - lag;
        if (length < 3) {
            return 0d;
        }
        double[] a = Arrays.copyOfRange(leader, 0, length);
        double[] b = Arrays.copyOfRange(follower, lag, lag + length);
        return pearson(a, b);
    }

    /** Fractional ranks, ties share the average rank. */
    static double[] ranks(double[] values) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (left, right) -> Double.compare(values[left], values[right]));
        double[] ranks = new double[values.length];
        int i = 0;
        while (i < order.length) {
            int j = i;
            while (j + 1 < order.length && values[order[j + 1]] == values[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = averageRank;
            }
            i = j + 1;
        }
        return ranks;
    }

    /** Centered moving average; edges use the available neighbours. */
    public static double[] centeredMovingAverage(double[] values, int window) {
        int half = window / 2;
        double[] smoothed = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(values.length - 1, i + half);
            double sum = 0d;
            for (int k = from; k <= to; k++) {
                sum += values[k];
            }
            smoothed[i] = sum / (to - from + 1);
        }
        return smoothed;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
