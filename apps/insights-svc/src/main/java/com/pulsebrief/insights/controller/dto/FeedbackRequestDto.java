package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.FeedbackAction;
import jakarta.validation.constraints.NotNull;

public record FeedbackRequestDto(@NotNull FeedbackAction action) {
}
