package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.FeedbackAction;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class AdaptiveThresholdStore {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveThresholdStore.class);

    private final Map<Key, ThresholdState> states = new ConcurrentHashMap<>();
    private final double step;
    private final double maxOffset;

    @Autowired

    public AdaptiveThresholdStore(InsightsProperties properties) {
        this(properties.detection().thresholdStep(), properties.detection().maxThresholdOffset());
    }

    AdaptiveThresholdStore(double step, double maxOffset) {
        this.step = step;
        this.maxOffset = maxOffset;
    }

    public ThresholdState stateFor(String tenantId, String kpiName) {
        return states.getOrDefault(new Key(tenantId, kpiName), ThresholdState.NEUTRAL);
    }

    public double offsetFor(String tenantId, String kpiName) {
        return stateFor(tenantId, kpiName).offset();
    }

    public ThresholdState recordFeedback(String tenantId, String kpiName, FeedbackAction action) {
        ThresholdState updated = states.compute(new Key(tenantId, kpiName),
                (key, current) -> (current == null ? ThresholdState.NEUTRAL : current).apply(action, step, maxOffset));
        log.info("Adaptive threshold: tenant={} kpi={} action={} offset={}", tenantId, kpiName, action,
                String.format(Locale.ROOT, "%.3f", updated.offset()));
        return updated;
    }

    private record Key(String tenantId, String kpiName) {
    }
}
