package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.ContentType;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Engagement history per (tenant, content type). The personalization factor stays neutral
 * until enough interactions exist and is bounded on both sides afterwards.
 */
@Component
public class EngagementStore {

    private final Map<String, Counts> counts = new ConcurrentHashMap<>();
    private final int minHistory;
    private final double min;
    private final double max;

    @Autowired

    public EngagementStore(InsightsProperties properties) {
        this(properties.briefing().minEngagementHistory(),
                properties.briefing().personalizationMin(),
                properties.briefing().personalizationMax());
    }

    EngagementStore(int minHistory, double min, double max) {
        this.minHistory = minHistory;
        this.min = min;
        this.max = max;
    }

    public void record(String tenantId, ContentType type, boolean engaged) {
        counts.compute(key(tenantId, type), (ignored, current) -> {
            Counts base = current == null ? new Counts(0, 0) : current;
            return engaged ? new Counts(base.engaged() + 1, base.ignored()) : new Counts(base.engaged(), base.ignored() + 1);
        });
    }

    /** {@code min + (max - min) * engagementRate}, or 1.0 below the history minimum. */
    public double factorFor(String tenantId, ContentType type) {
        Counts current = counts.get(key(tenantId, type));
        if (current == null || current.total() < minHistory) {
            return 1d;
        }
        double rate = (double) current.engaged() / current.total();
        return Statistics.clamp(min + (max - min) * rate, min, max);
    }

    public Counts countsFor(String tenantId, ContentType type) {
        return counts.getOrDefault(key(tenantId, type), new Counts(0, 0));
    }

    private static String key(String tenantId, ContentType type) {
        return tenantId + "|" + type;
    }

    public record Counts(int engaged, int ignored) {
        public int total() {
            return engaged + ignored;
        }
    }
}
