package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.error.ModelFitException;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tier 2: forecast from the cached seasonal model with a 95% interval. Insufficient
 * history or a failed fit makes the tier inapplicable for the point.
 */
@Component
public class SeasonalDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalDetector.class);

    private final SeasonalModelCache cache;
    private final double weight;

    @Autowired

    public SeasonalDetector(SeasonalModelCache cache, InsightsProperties properties) {
        this(cache, properties.detection().seasonalWeight());
    }

    SeasonalDetector(SeasonalModelCache cache, double weight) {
        this.cache = cache;
        this.weight = weight;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        PreparedSeries series = context.series();
        SeasonalModel model;
        try {
            model = cache.modelFor(context.tenantId(), series, context.targetIndex(), context.asOf());
        } catch (ModelFitException ex) {
            log.debug("Seasonal detector: skipped {} ({})", series.kpiName(), ex.getMessage());
            return DetectorResult.notApplicable(DetectionMethod.SEASONAL, ex.getMessage());
        }

        double actual = context.actual();
        double expected = model.forecast(context.targetTimestamp());
        double halfWidth = model.intervalHalfWidth();
        double deviations = Math.abs(actual - expected) / model.residualStd();
        double score = Statistics.clamp(deviations / (2 * SeasonalModel.INTERVAL_Z), 0d, 1d);
        cache.recordError(context.tenantId(), series.kpiName(), context.targetTimestamp(), actual, expected);
        return new DetectorResult(
                DetectionMethod.SEASONAL,
                true,
                score,
                expected,
                expected - halfWidth,
                expected + halfWidth,
                String.format(Locale.ROOT, "%.1f sigma from seasonal forecast", Math.min(deviations, 99d)));
    }
}
