package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps one seasonal model per (tenant, KPI). A model is refitted only when it is older
 * than the configured age, when its rolling absolute percentage error exceeds the
 * threshold, or when the grid it was fitted on no longer matches the series.
 */
@Component
public class SeasonalModelCache {

    private static final Logger log = LoggerFactory.getLogger(SeasonalModelCache.class);
    private static final double ERROR_SMOOTHING = 0.2d;

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final SeasonalModelFitter fitter;
    private final Duration maxAge;
    private final double refitErrorThreshold;

    @Autowired

    public SeasonalModelCache(SeasonalModelFitter fitter, InsightsProperties properties) {
        this(fitter, properties.detection().modelMaxAge(), properties.detection().refitErrorThreshold());
    }

    SeasonalModelCache(SeasonalModelFitter fitter, Duration maxAge, double refitErrorThreshold) {
        this.fitter = fitter;
        this.maxAge = maxAge;
        this.refitErrorThreshold = refitErrorThreshold;
    }

    /**
     * Model usable for forecasting {@code series} at {@code targetIndex}. A target inside
     * the cached model's fitted range gets a throwaway fit so history never leaks forward.
     */
    public SeasonalModel modelFor(String tenantId, PreparedSeries series, int targetIndex, Instant now) {
        Key key = new Key(tenantId, series.kpiName());
        Instant target = series.timestampAt(targetIndex);
        Entry entry = entries.get(key);
        if (entry != null && !target.isAfter(entry.model().fittedThrough())) {
            return fitter.fit(series, targetIndex, now);
        }
        String reason = entry == null ? null : refitReason(entry, series, now);
        if (entry == null || reason != null) {
            SeasonalModel model = fitter.fit(series, targetIndex, now);
            entries.put(key, new Entry(model, 0d, model.fittedThrough()));
            if (reason != null) {
                log.debug("Seasonal model: refit {} for tenant {} ({})", series.kpiName(), tenantId, reason);
            }
            return model;
        }
        return entry.model();
    }

    /**
     * Folds the latest forecast error into the rolling error. Each timestamp is counted
     * once even when successive runs re-evaluate it.
     */
    public void recordError(String tenantId, String kpiName, Instant timestamp, double actual, double expected) {
        entries.computeIfPresent(new Key(tenantId, kpiName), (key, entry) -> {
            if (!timestamp.isAfter(entry.lastScored())) {
                return entry;
            }
            double denominator = Math.max(Math.abs(actual), 1e-9d);
            double error = Math.min(1d, Math.abs(actual - expected) / denominator);
            double rolling = (1 - ERROR_SMOOTHING) * entry.rollingError() + ERROR_SMOOTHING * error;
            return new Entry(entry.model(), rolling, timestamp);
        });
    }

    public double rollingError(String tenantId, String kpiName) {
        Entry entry = entries.get(new Key(tenantId, kpiName));
        return entry == null ? 0d : entry.rollingError();
    }

    public void evictTenant(String tenantId) {
        entries.keySet().removeIf(key -> key.tenantId().equals(tenantId));
    }

    int size() {
        return entries.size();
    }

    private String refitReason(Entry entry, PreparedSeries series, Instant now) {
        SeasonalModel model = entry.model();
        if (Duration.between(model.fittedAt(), now).compareTo(maxAge) > 0) {
            return "stale";
        }
        if (entry.rollingError() > refitErrorThreshold) {
            return "rolling error " + String.format(Locale.ROOT, "%.3f", entry.rollingError());
        }
        if (!model.step().equals(series.frequency().step())
                || model.period() != series.frequency().seasonalPeriod()
                || Math.floorMod(Duration.between(model.origin(), series.origin()).getSeconds(), model.step().getSeconds()) != 0) {
            return "grid changed";
        }
        return null;
    }

    private record Key(String tenantId, String kpiName) {
    }

    private record Entry(SeasonalModel model, double rollingError, Instant lastScored) {
    }
}
