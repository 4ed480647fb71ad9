package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.SamplingFrequency;

public record KpiIngestResponseDto(String kpiName, SamplingFrequency frequency, int pointCount, String traceId) {
}
