package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Arrays;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tier 3: isolation forest over per-point features (level against the trailing week,
 * trailing volatility, one-step and one-period change rates, position within the
 * seasonal period and, when available, how far the other KPIs moved at the same time).
 */
@Component
public class MultivariateDetector implements Detector {

    static final int LOOKBACK = 7;
    private static final int MIN_TRAINING_ROWS = 8;
    private static final double SCORE_FLOOR = 0.4d;
    private static final double SCORE_RANGE = 0.35d;

    private final double weight;
    private final int trees;
    private final int sampleSize;

    @Autowired

    public MultivariateDetector(InsightsProperties properties) {
        this(properties.detection().multivariateWeight(),
                properties.detection().forestTrees(),
                properties.detection().forestSampleSize());
    }

    MultivariateDetector(double weight, int trees, int sampleSize) {
        this.weight = weight;
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MULTIVARIATE;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        int target = context.targetIndex();
        int trainingRows = target - LOOKBACK;
        if (trainingRows < MIN_TRAINING_ROWS) {
            return DetectorResult.notApplicable(DetectionMethod.MULTIVARIATE,
                    "needs " + (MIN_TRAINING_ROWS + LOOKBACK) + " points of history");
        }
        boolean withPeers = !context.snapshot().isEmpty();
        double[][] training = new double[trainingRows][];
        for (int i = LOOKBACK; i < target; i++) {
            training[i - LOOKBACK] = features(context, i, withPeers);
        }
        long seed = 31L * context.series().kpiName().hashCode() + target;
        IsolationForest forest = new IsolationForest(trees, sampleSize, seed).fit(training);
        double isolation = forest.score(features(context, target, withPeers));
        double score = Statistics.clamp((isolation - SCORE_FLOOR) / SCORE_RANGE, 0d, 1d);
        return new DetectorResult(DetectionMethod.MULTIVARIATE, true, score, null, null, null,
                String.format(Locale.ROOT, "isolation score %.3f over %d rows", isolation, trainingRows));
    }

    double[] features(DetectionContext context, int index, boolean withPeers) {
        PreparedSeries series = context.series();
        double[] values = series.values();
        double[] window = Arrays.copyOfRange(values, index - LOOKBACK, index);
        double trailingMean = Statistics.mean(window);
        double scale = Math.abs(trailingMean) > 0d ? Math.abs(trailingMean) : 1d;
        int period = series.frequency().seasonalPeriod();
        double phase = 2 * Math.PI * (index % period) / period;

        double[] row = new double[withPeers ? 7 : 6];
        row[0] = (values[index] - trailingMean) / scale;
        row[1] = Statistics.stdDev(window) / scale;
        row[2] = relativeChange(values[index - 1], values[index]);
        row[3] = relativeChange(values[index - LOOKBACK], values[index]);
        row[4] = Math.sin(phase);
        row[5] = Math.cos(phase);
        if (withPeers) {
            row[6] = context.snapshot().peerDeviation(series.timestampAt(index), series.kpiName());
        }
        return row;
    }

    private double relativeChange(double from, double to) {
        double base = Math.abs(from) > 0d ? Math.abs(from) : 1d;
        return (to - from) / base;
    }
}
