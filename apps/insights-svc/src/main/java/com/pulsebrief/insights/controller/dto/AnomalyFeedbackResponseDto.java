package com.pulsebrief.insights.controller.dto;

public record AnomalyFeedbackResponseDto(String kpi, double thresholdOffset, int confirmations, int dismissals,
                                         String traceId) {
}
