package com.pulsebrief.insights.controller.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.Map;

public record DerivedMetricsRequestDto(@NotEmpty Map<String, Double> metrics) {
}
