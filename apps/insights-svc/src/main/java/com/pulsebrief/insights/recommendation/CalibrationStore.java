package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.FeedbackAction;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per (tenant, rule or pattern) confidence multiplier learned from feedback. Every update
 * moves the factor a fixed fraction toward a target and the result is clamped, so the
 * factor never leaves [min, max].
 */
@Component
public class CalibrationStore {

    private static final Logger log = LoggerFactory.getLogger(CalibrationStore.class);

    private final Map<String, Double> factors = new ConcurrentHashMap<>();
    private final double min;
    private final double max;
    private final double step;

    @Autowired

    public CalibrationStore(InsightsProperties properties) {
        this(properties.recommendation().calibrationMin(),
                properties.recommendation().calibrationMax(),
                properties.recommendation().calibrationStep());
    }

    CalibrationStore(double min, double max, double step) {
        this.min = min;
        this.max = max;
        this.step = step;
    }

    public double factorFor(String tenantId, String sourceKey) {
        return factors.getOrDefault(key(tenantId, sourceKey), 1d);
    }

    public double record(String tenantId, String sourceKey, FeedbackAction action) {
        double updated = factors.compute(key(tenantId, sourceKey), (ignored, current) -> {
            double factor = current == null ? 1d : current;
            return switch (action) {
                case ACCEPTED, SCHEDULED -> move(factor, max, step);
                case DISMISSED -> move(factor, min, step);
                case IGNORED -> move(factor, min, step / 2d);
            };
        });
        log.debug("Calibration: tenant={} source={} action={} factor={}", tenantId, sourceKey, action, updated);
        return updated;
    }

    private double move(double factor, double target, double rate) {
        return Statistics.clamp(factor + rate * (target - factor), min, max);
    }

    private static String key(String tenantId, String sourceKey) {
        return tenantId + "|" + sourceKey;
    }
}
