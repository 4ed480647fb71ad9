package com.pulsebrief.insights.trend;

import com.pulsebrief.insights.anomaly.PreparedSeries;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Acceleration;
import com.pulsebrief.insights.model.EffectSize;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.model.TrendDirection;
import com.pulsebrief.insights.stats.LeastSquares;
import com.pulsebrief.insights.stats.Statistics;
import com.pulsebrief.insights.stats.WelchTest;
import java.util.Arrays;
import org.springframework.stereotype.Component;

/**
 * Compares the latest window of a KPI with the window before it. Pure function of the
 * series and timeframe, so repeated runs over the same history agree exactly.
 */
@Component
public class TrendAnalyzer {

    static final String METHOD = "welch_t_test";
    private static final double NEAR_ZERO = 1e-9d;

    private final InsightsProperties.Trend settings;

    public TrendAnalyzer(InsightsProperties properties) {
        this.settings = properties.trend();
    }

    public Trend analyze(PreparedSeries series, Timeframe timeframe) {
        int window = series.frequency().pointsFor(timeframe.days());
        int length = series.length();
        if (window < 2 || length < 2 * window) {
            return Trend.indeterminate(series.kpiName(), timeframe, METHOD);
        }
        double[] current = Arrays.copyOfRange(series.values(), length - window, length);
        double[] prior = Arrays.copyOfRange(series.values(), length - 2 * window, length - window);
        double currentMean = Statistics.mean(current);
        double priorMean = Statistics.mean(prior);
        if (Math.abs(priorMean) < NEAR_ZERO) {
            return Trend.indeterminate(series.kpiName(), timeframe, METHOD);
        }

        double change = (currentMean - priorMean) / Math.abs(priorMean);
        WelchTest test = WelchTest.compare(current, prior);
        boolean significant = test.pValue() < settings.significance();
        double[] both = Arrays.copyOfRange(series.values(), length - 2 * window, length);
        TrendDirection direction = classify(change, significant, both);

        Double slope = null;
        Double rSquared = null;
        LeastSquares.LineFit fit = LeastSquares.fitLine(both);
        if (timeframe.isMediumTerm()) {
            slope = fit.slope();
            rSquared = fit.rSquared();
        }
        Double periodGrowth = null;
        Double compoundRate = null;
        if (timeframe.isLongTerm()) {
            periodGrowth = change;
            if (currentMean > 0d && priorMean > 0d) {
                compoundRate = Math.pow(currentMean / priorMean, 30d / timeframe.days()) - 1d;
            }
        }

        double confidence = 0.4d * fit.rSquared()
                + 0.3d * Math.min(both.length / 30d, 1d)
                + 0.3d * Math.min(Math.abs(change) / 0.5d, 1d);

        return new Trend(
                series.kpiName(),
                timeframe,
                direction,
                change,
                currentMean - priorMean,
                currentMean,
                priorMean,
                test.pValue(),
                significant,
                EffectSize.fromCohensD(test.cohensD()),
                test.cohensD(),
                acceleration(current),
                slope,
                rSquared,
                periodGrowth,
                compoundRate,
                false,
                Statistics.clamp(confidence, 0d, 1d),
                METHOD);
    }

    TrendDirection classify(double change, boolean significant, double[] values) {
        if (Math.abs(change) < settings.minChange() || !significant) {
            return Statistics.coefficientOfVariation(values) > settings.volatilityCv()
                    ? TrendDirection.VOLATILE
                    : TrendDirection.FLAT;
        }
        return change > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }

    /**
     * Sign of the mean second difference of the smoothed window, normalised by the window
     * level. Growing movement in the direction of travel is acceleration.
     */
    Acceleration acceleration(double[] window) {
        if (window.length < 4) {
            return Acceleration.STEADY;
        }
        double[] smoothed = Statistics.centeredMovingAverage(window, 3);
        double firstSum = 0d;
        double secondSum = 0d;
        for (int i = 2; i < smoothed.length; i++) {
            firstSum += smoothed[i] - smoothed[i - 1];
            secondSum += smoothed[i] - 2 * smoothed[i - 1] + smoothed[i - 2];
        }
        int terms = smoothed.length - 2;
        double level = Math.abs(Statistics.mean(window));
        double scale = level > 0d ? level : 1d;
        double second = secondSum / terms / scale;
        double first = firstSum / terms;
        if (Math.abs(second) < settings.accelerationEpsilon()) {
            return Acceleration.STEADY;
        }
        if (first == 0d) {
            return second > 0 ? Acceleration.ACCELERATING : Acceleration.DECELERATING;
        }
        return Math.signum(second) == Math.signum(first) ? Acceleration.ACCELERATING : Acceleration.DECELERATING;
    }
}
