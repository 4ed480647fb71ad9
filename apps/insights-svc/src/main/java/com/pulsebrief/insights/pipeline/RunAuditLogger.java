package com.pulsebrief.insights.pipeline;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RunAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(RunAuditLogger.class);

    private final ConcurrentMap<String, AtomicInteger> runCounts = new ConcurrentHashMap<>();

    public int incrementRuns(String tenantId) {
        return runCounts.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
    }

    public void record(InsightsRunResult result) {
        int runs = incrementRuns(result.tenantId());
        log.info("insights_run tenant={} run={} runs={} type={} rules={} kpis={} anomalies={} trends={} edges={} "
                        + "recommendations={} briefing_items={} degraded={} issues={} elapsed_ms={}",
                result.tenantId(), result.runId(), runs, result.briefingType(), result.ruleTableVersion(),
                result.kpiCount(), result.anomalies().size(), result.trends().size(),
                result.dependencies().edges().size(), result.recommendations().size(), result.briefing().itemCount(),
                result.degraded(), result.issues().size(), result.elapsedMillis());
    }

    public void recordFailure(String tenantId, String briefingType, Throwable error) {
        log.warn("insights_run_failed tenant={} type={} error={}", tenantId, briefingType, error.toString());
    }
}
