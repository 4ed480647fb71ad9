package com.pulsebrief.insights.controller.dto;

public record ItemsUpsertResponseDto(String feed, int accepted, int total, String traceId) {
}
