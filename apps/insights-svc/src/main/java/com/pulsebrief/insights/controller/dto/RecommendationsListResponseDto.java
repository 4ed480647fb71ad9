package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.Recommendation;
import java.util.List;

public record RecommendationsListResponseDto(String tenantId, List<Recommendation> recommendations, String traceId) {
}
