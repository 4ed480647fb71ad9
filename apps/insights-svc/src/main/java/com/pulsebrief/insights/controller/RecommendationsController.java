package com.pulsebrief.insights.controller;

import com.pulsebrief.insights.controller.dto.FeedbackRequestDto;
import com.pulsebrief.insights.controller.dto.RecommendationsListResponseDto;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import com.pulsebrief.insights.recommendation.RecommendationService;
import com.pulsebrief.insights.web.RequestContextHolder;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class RecommendationsController {

    private final RecommendationService recommendationService;

    public RecommendationsController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/tenants/{tenantId}/recommendations")
    public ResponseEntity<RecommendationsListResponseDto> list(
            @PathVariable String tenantId,
            @RequestParam(value = "status", required = false) RecommendationStatus status
    ) {
        return ResponseEntity.ok(new RecommendationsListResponseDto(tenantId,
                recommendationService.listForTenant(tenantId, status), RequestContextHolder.currentTraceId()));
    }

    @GetMapping("/recommendations/{id}")
    public ResponseEntity<Recommendation> get(@PathVariable String id) {
        return ResponseEntity.ok(recommendationService.get(id));
    }

    /** Applies founder feedback; a recommendation that already left PENDING yields 409. */
    @PostMapping("/recommendations/{id}/feedback")
    public ResponseEntity<Recommendation> feedback(
            @PathVariable String id,
            @Valid @RequestBody FeedbackRequestDto request
    ) {
        return ResponseEntity.ok(recommendationService.applyFeedback(id, request.action()));
    }
}
