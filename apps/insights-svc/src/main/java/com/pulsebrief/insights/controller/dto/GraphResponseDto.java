package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.correlation.DependencyAnalysis;
import java.time.Instant;

public record GraphResponseDto(String runId, Instant asOf, DependencyAnalysis graph, String traceId) {
}
