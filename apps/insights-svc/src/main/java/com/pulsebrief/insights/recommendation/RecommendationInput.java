package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.trend.TrendService;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the recommendation stages read for one tenant run. {@code latestValues} holds
 * the most recent value of each KPI plus any derived metrics from the KPI feed.
 */
public record RecommendationInput(
        String tenantId,
        Instant asOf,
        Map<String, Double> latestValues,
        TrendService.TrendReport trends,
        List<PatternMatch> patternMatches,
        RecommendationSignals signals,
        List<String> evidence
) {

    public RecommendationInput {
        latestValues = latestValues == null ? Map.of() : Map.copyOf(latestValues);
        trends = trends == null ? new TrendService.TrendReport(List.of(), List.of()) : trends;
        patternMatches = patternMatches == null ? List.of() : List.copyOf(patternMatches);
        signals = signals == null ? RecommendationSignals.neutral() : signals;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
