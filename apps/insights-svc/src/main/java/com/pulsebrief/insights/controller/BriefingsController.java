package com.pulsebrief.insights.controller;

import com.pulsebrief.insights.briefing.BriefingService;
import com.pulsebrief.insights.controller.dto.FeedbackRequestDto;
import com.pulsebrief.insights.model.Briefing;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class BriefingsController {

    private final BriefingService briefingService;

    public BriefingsController(BriefingService briefingService) {
        this.briefingService = briefingService;
    }

    @GetMapping("/tenants/{tenantId}/briefings/latest")
    public ResponseEntity<Briefing> latest(@PathVariable String tenantId) {
        return ResponseEntity.ok(briefingService.latest(tenantId));
    }

    @GetMapping("/briefings/{id}")
    public ResponseEntity<Briefing> get(@PathVariable String id) {
        return ResponseEntity.ok(briefingService.get(id));
    }

    @PostMapping("/briefings/{id}/read")
    public ResponseEntity<Void> markRead(@PathVariable String id) {
        briefingService.markRead(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/briefings/{id}/items/{itemId}/engagement")
    public ResponseEntity<Void> engagement(
            @PathVariable String id,
            @PathVariable String itemId,
            @Valid @RequestBody FeedbackRequestDto request
    ) {
        briefingService.recordEngagement(id, itemId, request.action());
        return ResponseEntity.noContent().build();
    }
}
