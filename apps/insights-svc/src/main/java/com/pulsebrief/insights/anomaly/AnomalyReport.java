package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.DataQualityIssue;
import java.util.List;

/**
 * {@code anomalies} covers the evaluation window reported for this run. {@code history}
 * additionally reaches back far enough for root-cause tracing to find upstream anomalies
 * one or more edge lags earlier; it always contains every entry of {@code anomalies}.
 */
public record AnomalyReport(List<Anomaly> anomalies, List<Anomaly> history, List<DataQualityIssue> issues) {

    public AnomalyReport {
        anomalies = List.copyOf(anomalies);
        history = List.copyOf(history);
        issues = List.copyOf(issues);
    }

    public static AnomalyReport empty() {
        return new AnomalyReport(List.of(), List.of(), List.of());
    }
}
