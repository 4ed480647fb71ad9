package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.pipeline.InsightsRunResult;
import java.time.Instant;
import java.util.List;

public record RunResponseDto(
        String runId,
        String tenantId,
        BriefingType briefingType,
        Instant asOf,
        String ruleTableVersion,
        int kpiCount,
        int anomalyCount,
        int trendCount,
        int recommendationCount,
        String briefingId,
        boolean degraded,
        List<DataQualityIssue> issues,
        long elapsedMillis,
        String traceId
) {

    public static RunResponseDto from(InsightsRunResult result, String traceId) {
        return new RunResponseDto(
                result.runId(),
                result.tenantId(),
                result.briefingType(),
                result.asOf(),
                result.ruleTableVersion(),
                result.kpiCount(),
                result.anomalies().size(),
                result.trends().size(),
                result.recommendations().size(),
                result.briefing() == null ? null : result.briefing().id(),
                result.degraded(),
                result.issues(),
                result.elapsedMillis(),
                traceId
        );
    }
}
