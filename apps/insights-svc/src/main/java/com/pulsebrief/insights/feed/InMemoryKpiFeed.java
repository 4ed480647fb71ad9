package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.SamplingFrequency;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryKpiFeed implements KpiFeed {

    private final Map<String, Map<String, KpiSeries>> series = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Double>> derived = new ConcurrentHashMap<>();

    @Override
    public Set<String> tenants() {
        Set<String> tenants = new HashSet<>(series.keySet());
        tenants.addAll(derived.keySet());
        return Set.copyOf(tenants);
    }

    @Override
    public Map<String, KpiSeries> seriesFor(String tenantId) {
        return Map.copyOf(series.getOrDefault(tenantId, Map.of()));
    }

    @Override
    public Map<String, Double> derivedMetrics(String tenantId) {
        return Map.copyOf(derived.getOrDefault(tenantId, Map.of()));
    }

    @Override
    public KpiSeries ingest(String tenantId, String kpiName, SamplingFrequency frequency, List<KpiPoint> points) {
        Map<String, KpiSeries> tenantSeries = series.computeIfAbsent(tenantId, ignored -> new ConcurrentHashMap<>());
        return tenantSeries.compute(kpiName, (name, existing) -> {
            Map<Instant, KpiPoint> merged = new TreeMap<>();
            if (existing != null) {
                existing.points().forEach(point -> merged.put(point.timestamp(), point));
            }
            points.forEach(point -> merged.put(point.timestamp(), point));
            SamplingFrequency resolved = frequency != null ? frequency
                    : existing != null ? existing.frequency() : SamplingFrequency.DAILY;
            return new KpiSeries(name, new ArrayList<>(merged.values()), resolved);
        });
    }

    @Override
    public void putDerivedMetric(String tenantId, String metric, double value) {
        derived.computeIfAbsent(tenantId, ignored -> new ConcurrentHashMap<>()).put(metric, value);
    }
}
