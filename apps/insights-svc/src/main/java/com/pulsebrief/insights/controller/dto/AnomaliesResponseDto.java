package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.JointAnomaly;
import com.pulsebrief.insights.model.RootCauseFinding;
import java.time.Instant;
import java.util.List;

public record AnomaliesResponseDto(
        String runId,
        Instant asOf,
        List<Anomaly> anomalies,
        List<RootCauseFinding> rootCauses,
        JointAnomaly jointAnomaly,
        String traceId
) {
}
