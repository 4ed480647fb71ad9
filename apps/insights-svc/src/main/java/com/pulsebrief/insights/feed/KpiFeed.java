package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.SamplingFrequency;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read access to tenant KPI series, plus the ingestion hook used to seed them. Derived
 * metrics (runway, LTV/CAC and the like) are single current values with no history.
 */
public interface KpiFeed {

    Set<String> tenants();

    Map<String, KpiSeries> seriesFor(String tenantId);

    Map<String, Double> derivedMetrics(String tenantId);

    /** Merges points into the series; a point replaces an existing one at the same timestamp. */
    KpiSeries ingest(String tenantId, String kpiName, SamplingFrequency frequency, List<KpiPoint> points);

    void putDerivedMetric(String tenantId, String metric, double value);
}
