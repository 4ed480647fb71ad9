package com.pulsebrief.insights.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pulsebrief.insights.correlation.DependencyAnalysis;
import com.pulsebrief.insights.model.Briefing;
import com.pulsebrief.insights.model.BriefingType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TenantRunCoordinatorTest {

    private static final Instant AS_OF = Instant.parse("2024-06-03T07:00:00Z");

    private final InsightsPipeline pipeline = mock(InsightsPipeline.class);
    private final RunAuditLogger auditLogger = mock(RunAuditLogger.class);
    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    static InsightsRunResult result(String tenantId, BriefingType type) {
        Briefing briefing = new Briefing("briefing-" + tenantId, tenantId, type, AS_OF, List.of(), 0d, null);
        return new InsightsRunResult("run-" + tenantId, tenantId, type, AS_OF, "test", 0, List.of(), List.of(),
                DependencyAnalysis.empty(), List.of(), List.of(), null, List.of(), briefing, List.of(), 1L);
    }

    @Test
    void failingTenantDoesNotStopTheOthers() {
        when(pipeline.run("acme", BriefingType.MORNING, AS_OF)).thenReturn(result("acme", BriefingType.MORNING));
        when(pipeline.run("broken", BriefingType.MORNING, AS_OF)).thenThrow(new IllegalStateException("boom"));
        when(pipeline.run("zeta", BriefingType.MORNING, AS_OF)).thenReturn(result("zeta", BriefingType.MORNING));
        TenantRunCoordinator coordinator = new TenantRunCoordinator(pipeline, executor, auditLogger, Duration.ofSeconds(5));

        Map<String, InsightsRunResult> results = coordinator.runAll(List.of("zeta", "broken", "acme"), BriefingType.MORNING, AS_OF);

        assertThat(results).containsOnlyKeys("acme", "zeta");
        verify(auditLogger).recordFailure(eq("broken"), eq("MORNING"), any(IllegalStateException.class));
    }

    @Test
    void tenantOverTheDeadlineIsCancelled() {
        when(pipeline.run("fast", BriefingType.EVENING, AS_OF)).thenReturn(result("fast", BriefingType.EVENING));
        when(pipeline.run("slow", BriefingType.EVENING, AS_OF)).thenAnswer(invocation -> {
            Thread.sleep(10_000L);
            return result("slow", BriefingType.EVENING);
        });
        TenantRunCoordinator coordinator = new TenantRunCoordinator(pipeline, executor, auditLogger, Duration.ofMillis(300));

        Map<String, InsightsRunResult> results = coordinator.runAll(List.of("fast", "slow"), BriefingType.EVENING, AS_OF);

        assertThat(results).containsOnlyKeys("fast");
        verify(auditLogger).recordFailure(eq("slow"), eq("EVENING"), any(TimeoutException.class));
    }

    @Test
    void directRunGoesThroughThePipeline() {
        when(pipeline.run("acme", BriefingType.WEEKLY, AS_OF)).thenReturn(result("acme", BriefingType.WEEKLY));
        TenantRunCoordinator coordinator = new TenantRunCoordinator(pipeline, executor, auditLogger, Duration.ofSeconds(5));

        assertThat(coordinator.runTenant("acme", BriefingType.WEEKLY, AS_OF).runId()).isEqualTo("run-acme");
    }
}
