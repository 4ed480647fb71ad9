package com.pulsebrief.insights.controller;

import com.pulsebrief.insights.anomaly.AdaptiveThresholdStore;
import com.pulsebrief.insights.anomaly.ThresholdState;
import com.pulsebrief.insights.controller.dto.AnomaliesResponseDto;
import com.pulsebrief.insights.controller.dto.AnomalyFeedbackRequestDto;
import com.pulsebrief.insights.controller.dto.AnomalyFeedbackResponseDto;
import com.pulsebrief.insights.controller.dto.GraphResponseDto;
import com.pulsebrief.insights.controller.dto.RunResponseDto;
import com.pulsebrief.insights.controller.dto.TrendsResponseDto;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.pipeline.InsightsRunRepository;
import com.pulsebrief.insights.pipeline.InsightsRunResult;
import com.pulsebrief.insights.pipeline.TenantRunCoordinator;
import com.pulsebrief.insights.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.NoSuchElementException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class InsightsController {

    private final TenantRunCoordinator coordinator;
    private final InsightsRunRepository runs;
    private final AdaptiveThresholdStore thresholds;
    private final Clock clock;

    public InsightsController(
            TenantRunCoordinator coordinator,
            InsightsRunRepository runs,
            AdaptiveThresholdStore thresholds,
            Clock clock
    ) {
        this.coordinator = coordinator;
        this.runs = runs;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    /** Runs the full pipeline synchronously; {@code asOf} defaults to now. */
    @PostMapping("/runs")
    public ResponseEntity<RunResponseDto> run(
            @PathVariable String tenantId,
            @RequestParam(value = "type", required = false, defaultValue = "MORNING") BriefingType type,
            @RequestParam(value = "asOf", required = false) Instant asOf
    ) {
        Instant effectiveAsOf = asOf == null ? clock.instant() : asOf;
        InsightsRunResult result = coordinator.runTenant(tenantId, type, effectiveAsOf);
        return ResponseEntity.ok(RunResponseDto.from(result, RequestContextHolder.currentTraceId()));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomaliesResponseDto> anomalies(
            @PathVariable String tenantId,
            @RequestParam(value = "kpi", required = false) String kpi
    ) {
        InsightsRunResult latest = latestRun(tenantId);
        var anomalies = latest.anomalies().stream()
                .filter(anomaly -> kpi == null || anomaly.kpiName().equals(kpi))
                .toList();
        var rootCauses = latest.rootCauses().stream()
                .filter(finding -> kpi == null || finding.kpiName().equals(kpi))
                .toList();
        return ResponseEntity.ok(new AnomaliesResponseDto(latest.runId(), latest.asOf(), anomalies, rootCauses,
                latest.jointAnomaly(), RequestContextHolder.currentTraceId()));
    }

    @GetMapping("/trends")
    public ResponseEntity<TrendsResponseDto> trends(
            @PathVariable String tenantId,
            @RequestParam(value = "timeframe", required = false) Timeframe timeframe
    ) {
        InsightsRunResult latest = latestRun(tenantId);
        var trends = latest.trends().stream()
                .filter(trend -> timeframe == null || trend.timeframe() == timeframe)
                .toList();
        return ResponseEntity.ok(new TrendsResponseDto(latest.runId(), latest.asOf(), trends, latest.patternMatches(),
                RequestContextHolder.currentTraceId()));
    }

    @GetMapping("/graph")
    public ResponseEntity<GraphResponseDto> graph(@PathVariable String tenantId) {
        InsightsRunResult latest = latestRun(tenantId);
        return ResponseEntity.ok(new GraphResponseDto(latest.runId(), latest.asOf(), latest.dependencies(),
                RequestContextHolder.currentTraceId()));
    }

    @PostMapping("/anomalies/feedback")
    public ResponseEntity<AnomalyFeedbackResponseDto> anomalyFeedback(
            @PathVariable String tenantId,
            @Valid @RequestBody AnomalyFeedbackRequestDto request
    ) {
        ThresholdState state = thresholds.recordFeedback(tenantId, request.kpi(), request.action());
        return ResponseEntity.ok(new AnomalyFeedbackResponseDto(request.kpi(), state.offset(), state.confirmations(),
                state.dismissals(), RequestContextHolder.currentTraceId()));
    }

    private InsightsRunResult latestRun(String tenantId) {
        return runs.findLatest(tenantId)
                .orElseThrow(() -> new NoSuchElementException("No run recorded for tenant " + tenantId));
    }
}
