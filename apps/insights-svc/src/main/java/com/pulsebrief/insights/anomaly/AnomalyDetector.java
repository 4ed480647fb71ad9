package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.AnomalyDirection;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.model.Severity;
import com.pulsebrief.insights.stats.Statistics;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the detector tiers into one weighted score. Any {@link Detector} bean joins
 * the ensemble; tiers that are not applicable to a point are left out and the remaining
 * weights renormalised.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    static final double MISSING_SEASONAL_PENALTY = 0.85d;

    private final List<Detector> detectors;

    public AnomalyDetector(List<Detector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(Detector::method))
                .toList();
    }

    public Optional<Anomaly> detect(DetectionContext context, double threshold) {
        List<DetectorResult> results = new ArrayList<>();
        double weightSum = 0d;
        double weighted = 0d;
        for (Detector detector : detectors) {
            DetectorResult result = detector.detect(context);
            results.add(result);
            if (result.applicable() && detector.weight() > 0d) {
                weightSum += detector.weight();
                weighted += detector.weight() * result.score();
            }
        }
        if (weightSum == 0d) {
            log.debug("Anomaly detection: no applicable tier for {} at index {}",
                    context.series().kpiName(), context.targetIndex());
            return Optional.empty();
        }
        double combined = Statistics.clamp(weighted / weightSum, 0d, 1d);
        if (combined < threshold) {
            return Optional.empty();
        }
        return Optional.of(toAnomaly(context, results, combined));
    }

    public static Severity severityFor(double combinedScore) {
        if (combinedScore >= 0.85d) {
            return Severity.CRITICAL;
        }
        if (combinedScore >= 0.7d) {
            return Severity.HIGH;
        }
        if (combinedScore >= 0.55d) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private Anomaly toAnomaly(DetectionContext context, List<DetectorResult> results, double combined) {
        PreparedSeries series = context.series();
        double actual = context.actual();
        double expected = expectedValue(results, context);
        double magnitude = expected == 0d ? 0d : (actual - expected) / Math.abs(expected);
        AnomalyDirection direction = actual < expected ? AnomalyDirection.DOWN : AnomalyDirection.UP;
        boolean seasonalApplied = results.stream()
                .anyMatch(result -> result.method() == DetectionMethod.SEASONAL && result.applicable());
        double confidence = combined * series.qualityFactor(context.targetIndex())
                * (seasonalApplied ? 1d : MISSING_SEASONAL_PENALTY);
        List<DetectionMethod> contributing = results.stream()
                .filter(DetectorResult::flags)
                .map(DetectorResult::method)
                .toList();

        String id = UUID.nameUUIDFromBytes((context.tenantId() + "|" + series.kpiName() + "|" + context.targetTimestamp())
                .getBytes(StandardCharsets.UTF_8)).toString();
        return new Anomaly(
                id,
                series.kpiName(),
                context.targetTimestamp(),
                actual,
                expected,
                magnitude,
                direction,
                severityFor(combined),
                combined,
                Statistics.clamp(confidence, 0d, 1d),
                contributing,
                explanation(context, expected, magnitude, direction, contributing, results));
    }

    private double expectedValue(List<DetectorResult> results, DetectionContext context) {
        for (DetectionMethod preferred : List.of(DetectionMethod.SEASONAL, DetectionMethod.STATISTICAL)) {
            for (DetectorResult result : results) {
                if (result.method() == preferred && result.applicable() && result.expected() != null) {
                    return result.expected();
                }
            }
        }
        return Statistics.median(context.history());
    }

    private String explanation(
            DetectionContext context,
            double expected,
            double magnitude,
            AnomalyDirection direction,
            List<DetectionMethod> contributing,
            List<DetectorResult> results) {
        StringBuilder text = new StringBuilder();
        text.append(context.series().kpiName())
                .append(" was ")
                .append(String.format(Locale.ROOT, "%.2f", context.actual()))
                .append(" on ")
                .append(DAY.format(context.targetTimestamp()))
                .append(", ")
                .append(String.format(Locale.ROOT, "%.1f%%", Math.abs(magnitude) * 100))
                .append(direction == AnomalyDirection.DOWN ? " below" : " above")
                .append(" the expected ")
                .append(String.format(Locale.ROOT, "%.2f", expected));
        if (!contributing.isEmpty()) {
            text.append("; flagged by ")
                    .append(contributing.stream().map(method -> method.name().toLowerCase(Locale.ROOT))
                            .collect(Collectors.joining(", ")));
        }
        String notes = results.stream()
                .filter(DetectorResult::applicable)
                .map(DetectorResult::note)
                .collect(Collectors.joining("; "));
        if (!notes.isBlank()) {
            text.append(" (").append(notes).append(")");
        }
        if (context.series().imputed()[context.targetIndex()]) {
            text.append("; value was interpolated");
        }
        return text.toString();
    }
}
