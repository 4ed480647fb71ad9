package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.FeedbackAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AnomalyFeedbackRequestDto(@NotBlank String kpi, @NotNull FeedbackAction action) {
}
