package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tier 1: modified z-score (Iglewicz-Hoaglin) on the trailing window. Short histories
 * are judged against a population prior instead.
 */
@Component
public class StatisticalDetector implements Detector {

    static final double MODIFIED_Z_CONSTANT = 0.6745d;
    static final double MODIFIED_Z_THRESHOLD = 3.5d;
    private static final double MEAN_ABS_TO_MAD = 1.253314d;

    private final double weight;
    private final int robustWindow;
    private final int minHistory;

    @Autowired

    public StatisticalDetector(InsightsProperties properties) {
        this(properties.detection().statisticalWeight(),
                properties.detection().robustWindow(),
                properties.detection().minHistory());
    }

    StatisticalDetector(double weight, int robustWindow, int minHistory) {
        this.weight = weight;
        this.robustWindow = robustWindow;
        this.minHistory = minHistory;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        double actual = context.actual();
        double[] window = context.series().trailing(context.targetIndex(), robustWindow);
        if (window.length < minHistory) {
            return populationPrior(context, window, actual);
        }

        double median = Statistics.median(window);
        double mad = Statistics.medianAbsoluteDeviation(window);
        if (mad == 0d) {
            mad = MEAN_ABS_TO_MAD * Statistics.meanAbsoluteDeviation(window);
        }
        double z;
        if (mad == 0d) {
            z = actual == median ? 0d : Double.POSITIVE_INFINITY;
        } else {
            z = MODIFIED_Z_CONSTANT * (actual - median) / mad;
        }
        double spread = mad == 0d ? 0d : mad / MODIFIED_Z_CONSTANT * MODIFIED_Z_THRESHOLD;
        return new DetectorResult(
                DetectionMethod.STATISTICAL,
                true,
                scoreFor(z),
                median,
                median - spread,
                median + spread,
                String.format(Locale.ROOT, "modified z %.2f over %d points", Math.min(Math.abs(z), 99d), window.length));
    }

    private DetectorResult populationPrior(DetectionContext context, double[] window, double actual) {
        if (window.length == 0) {
            return DetectorResult.notApplicable(DetectionMethod.STATISTICAL, "no history");
        }
        double mean = Statistics.mean(window);
        double sigma = context.populationPriorCv() * Math.abs(mean);
        if (sigma == 0d) {
            return DetectorResult.notApplicable(DetectionMethod.STATISTICAL, "zero baseline, prior undefined");
        }
        double z = (actual - mean) / sigma;
        double spread = MODIFIED_Z_THRESHOLD * sigma;
        return new DetectorResult(
                DetectionMethod.STATISTICAL,
                true,
                scoreFor(z),
                mean,
                mean - spread,
                mean + spread,
                String.format(Locale.ROOT, "population prior z %.2f (cv %.2f)", Math.min(Math.abs(z), 99d), context.populationPriorCv()));
    }

    static double scoreFor(double z) {
        return Statistics.clamp(Math.abs(z) / (2 * MODIFIED_Z_THRESHOLD), 0d, 1d);
    }
}
