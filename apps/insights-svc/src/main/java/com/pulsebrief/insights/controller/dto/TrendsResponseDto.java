package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.Trend;
import java.time.Instant;
import java.util.List;

public record TrendsResponseDto(String runId, Instant asOf, List<Trend> trends, List<PatternMatch> patterns,
                                String traceId) {
}
