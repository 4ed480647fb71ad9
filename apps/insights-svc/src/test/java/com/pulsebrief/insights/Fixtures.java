package com.pulsebrief.insights;

import com.pulsebrief.insights.model.Acceleration;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.AnomalyDirection;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.model.EffectSize;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationSource;
import com.pulsebrief.insights.model.RecommendationStatus;
import com.pulsebrief.insights.model.Severity;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.model.TrendDirection;
import java.time.Instant;
import java.util.List;

/**
 * Hand-built analytical results for tests that start downstream of detection.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Trend trend(String kpi, Timeframe timeframe, TrendDirection direction) {
        return trend(kpi, timeframe, direction, Acceleration.STEADY);
    }

    public static Trend trend(String kpi, Timeframe timeframe, TrendDirection direction, Acceleration acceleration) {
        double change = switch (direction) {
            case UP -> 0.12d;
            case DOWN -> -0.12d;
            default -> 0d;
        };
        boolean significant = direction == TrendDirection.UP || direction == TrendDirection.DOWN;
        return new Trend(kpi, timeframe, direction, change, change * 100, 100 + change * 100, 100, significant ? 0.01d : 0.4d,
                significant, significant ? EffectSize.LARGE : EffectSize.NEGLIGIBLE, significant ? 1.2d : 0.1d,
                acceleration, null, null, null, null, false, 0.7d, "welch_t_test");
    }

    public static Anomaly anomaly(String kpi, Instant timestamp, double score, AnomalyDirection direction) {
        return new Anomaly("anomaly-" + kpi + "-" + timestamp.getEpochSecond(), kpi, timestamp, 60d, 100d,
                direction == AnomalyDirection.DOWN ? -0.4d : 0.4d, direction, severityFor(score), score, score,
                List.of(DetectionMethod.STATISTICAL, DetectionMethod.SEASONAL), kpi + " moved sharply");
    }

    public static Recommendation recommendation(String id, String category, double score, boolean pinned, Instant createdAt) {
        return new Recommendation(id, "tenant-a", category, category + " action " + id, "Do something about " + category,
                null, score, 0.5d, 0.5d, 0.5d, 0.8d, pinned ? PriorityLevel.CRITICAL : PriorityLevel.MEDIUM,
                List.of("First step"), pinned ? RecommendationSource.RULE : RecommendationSource.PATTERN, "source-" + id,
                RecommendationStatus.PENDING, pinned, createdAt);
    }

    private static Severity severityFor(double score) {
        if (score >= 0.85d) {
            return Severity.CRITICAL;
        }
        if (score >= 0.7d) {
            return Severity.HIGH;
        }
        return score >= 0.55d ? Severity.MEDIUM : Severity.LOW;
    }
}
