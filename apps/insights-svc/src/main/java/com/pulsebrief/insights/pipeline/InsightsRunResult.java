package com.pulsebrief.insights.pipeline;

import com.pulsebrief.insights.correlation.DependencyAnalysis;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.Briefing;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.JointAnomaly;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RootCauseFinding;
import com.pulsebrief.insights.model.Trend;
import java.time.Instant;
import java.util.List;

/**
 * Everything one tenant run produced. {@code jointAnomaly} is null when the joint pass
 * had too little aligned history.
 */
public record InsightsRunResult(
        String runId,
        String tenantId,
        BriefingType briefingType,
        Instant asOf,
        String ruleTableVersion,
        int kpiCount,
        List<Anomaly> anomalies,
        List<Trend> trends,
        DependencyAnalysis dependencies,
        List<RootCauseFinding> rootCauses,
        List<PatternMatch> patternMatches,
        JointAnomaly jointAnomaly,
        List<Recommendation> recommendations,
        Briefing briefing,
        List<DataQualityIssue> issues,
        long elapsedMillis
) {

    public InsightsRunResult {
        anomalies = List.copyOf(anomalies);
        trends = List.copyOf(trends);
        rootCauses = List.copyOf(rootCauses);
        patternMatches = List.copyOf(patternMatches);
        recommendations = List.copyOf(recommendations);
        issues = List.copyOf(issues);
    }

    public boolean degraded() {
        return !issues.isEmpty();
    }
}
