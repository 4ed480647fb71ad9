package com.pulsebrief.insights.controller;

import com.pulsebrief.insights.controller.dto.DerivedMetricsRequestDto;
import com.pulsebrief.insights.controller.dto.FounderProfileRequestDto;
import com.pulsebrief.insights.controller.dto.ItemsUpsertResponseDto;
import com.pulsebrief.insights.controller.dto.KpiIngestRequestDto;
import com.pulsebrief.insights.controller.dto.KpiIngestResponseDto;
import com.pulsebrief.insights.feed.CalendarFeed;
import com.pulsebrief.insights.feed.DecisionFeed;
import com.pulsebrief.insights.feed.FounderProfileRepository;
import com.pulsebrief.insights.feed.ItemFeed;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.feed.MessageFeed;
import com.pulsebrief.insights.feed.TaskFeed;
import com.pulsebrief.insights.model.DecisionItem;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.MeetingItem;
import com.pulsebrief.insights.model.MessageItem;
import com.pulsebrief.insights.model.TaskItem;
import com.pulsebrief.insights.web.RequestContextHolder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoints that seed the in-memory feeds a run reads from.
 */
@RestController
@Validated
@RequestMapping("/api/v1/tenants/{tenantId}")
public class TenantFeedController {

    private static final Logger log = LoggerFactory.getLogger(TenantFeedController.class);
    private static final int MAX_ITEMS = 500;

    private final KpiFeed kpiFeed;
    private final TaskFeed taskFeed;
    private final CalendarFeed calendarFeed;
    private final MessageFeed messageFeed;
    private final DecisionFeed decisionFeed;
    private final FounderProfileRepository profiles;

    public TenantFeedController(
            KpiFeed kpiFeed,
            TaskFeed taskFeed,
            CalendarFeed calendarFeed,
            MessageFeed messageFeed,
            DecisionFeed decisionFeed,
            FounderProfileRepository profiles
    ) {
        this.kpiFeed = kpiFeed;
        this.taskFeed = taskFeed;
        this.calendarFeed = calendarFeed;
        this.messageFeed = messageFeed;
        this.decisionFeed = decisionFeed;
        this.profiles = profiles;
    }

    @PostMapping("/kpis")
    public ResponseEntity<KpiIngestResponseDto> ingestKpi(
            @PathVariable String tenantId,
            @Valid @RequestBody KpiIngestRequestDto request
    ) {
        KpiSeries series = kpiFeed.ingest(tenantId, request.kpiName(), request.frequencyOrDefault(), request.toPoints());
        log.info("KPI ingest: tenant={} kpi={} received={} stored={}",
                tenantId, series.kpiName(), request.points().size(), series.points().size());
        return ResponseEntity.ok(new KpiIngestResponseDto(series.kpiName(), series.frequency(), series.points().size(),
                RequestContextHolder.currentTraceId()));
    }

    @PostMapping("/metrics")
    public ResponseEntity<Map<String, Double>> putDerivedMetrics(
            @PathVariable String tenantId,
            @Valid @RequestBody DerivedMetricsRequestDto request
    ) {
        request.metrics().forEach((metric, value) -> {
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("metric " + metric + " needs a finite value");
            }
            kpiFeed.putDerivedMetric(tenantId, metric, value);
        });
        return ResponseEntity.ok(kpiFeed.derivedMetrics(tenantId));
    }

    @PutMapping("/profile")
    public ResponseEntity<FounderProfile> putProfile(
            @PathVariable String tenantId,
            @Valid @RequestBody FounderProfileRequestDto request
    ) {
        return ResponseEntity.ok(profiles.save(request.toProfile(tenantId)));
    }

    @GetMapping("/profile")
    public ResponseEntity<FounderProfile> getProfile(@PathVariable String tenantId) {
        return ResponseEntity.ok(profiles.findOrDefault(tenantId));
    }

    @PostMapping("/tasks")
    public ResponseEntity<ItemsUpsertResponseDto> upsertTasks(
            @PathVariable String tenantId,
            @RequestBody @Size(max = MAX_ITEMS) List<TaskItem> items
    ) {
        return upsert("tasks", taskFeed, tenantId, items);
    }

    @PostMapping("/meetings")
    public ResponseEntity<ItemsUpsertResponseDto> upsertMeetings(
            @PathVariable String tenantId,
            @RequestBody @Size(max = MAX_ITEMS) List<MeetingItem> items
    ) {
        return upsert("meetings", calendarFeed, tenantId, items);
    }

    @PostMapping("/messages")
    public ResponseEntity<ItemsUpsertResponseDto> upsertMessages(
            @PathVariable String tenantId,
            @RequestBody @Size(max = MAX_ITEMS) List<MessageItem> items
    ) {
        return upsert("messages", messageFeed, tenantId, items);
    }

    @PostMapping("/decisions")
    public ResponseEntity<ItemsUpsertResponseDto> upsertDecisions(
            @PathVariable String tenantId,
            @RequestBody @Size(max = MAX_ITEMS) List<DecisionItem> items
    ) {
        return upsert("decisions", decisionFeed, tenantId, items);
    }

    private <T> ResponseEntity<ItemsUpsertResponseDto> upsert(String name, ItemFeed<T> feed, String tenantId, List<T> items) {
        feed.upsert(tenantId, items);
        int total = feed.itemsFor(tenantId).size();
        log.debug("Feed upsert: tenant={} feed={} accepted={} total={}", tenantId, name, items.size(), total);
        return ResponseEntity.ok(new ItemsUpsertResponseDto(name, items.size(), total, RequestContextHolder.currentTraceId()));
    }
}
