package com.pulsebrief.insights.pipeline;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.BriefingType;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs tenants in parallel on a fixed pool. A per-tenant lock serialises runs of the same
 * tenant, so adaptive per-tenant state is never updated by two runs at once.
 */
@Component
public class TenantRunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TenantRunCoordinator.class);

    private final InsightsPipeline pipeline;
    private final ExecutorService executor;
    private final RunAuditLogger auditLogger;
    private final Duration runTimeout;
    private final Map<String, ReentrantLock> tenantLocks = new ConcurrentHashMap<>();

    @Autowired

    public TenantRunCoordinator(InsightsPipeline pipeline,
                                @Qualifier("tenantRunExecutor") ExecutorService executor,
                                RunAuditLogger auditLogger,
                                InsightsProperties properties) {
        this(pipeline, executor, auditLogger, properties.schedule().tenantRunTimeout());
    }

    TenantRunCoordinator(InsightsPipeline pipeline, ExecutorService executor, RunAuditLogger auditLogger,
                         Duration runTimeout) {
        this.pipeline = pipeline;
        this.executor = executor;
        this.auditLogger = auditLogger;
        this.runTimeout = runTimeout;
    }

    /** Runs one tenant on the calling thread, waiting for any run of the same tenant to finish. */
    public InsightsRunResult runTenant(String tenantId, BriefingType type, Instant asOf) {
        ReentrantLock lock = tenantLocks.computeIfAbsent(tenantId, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return pipeline.run(tenantId, type, asOf);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every tenant and returns the successful results by tenant. A tenant that fails
     * or exceeds the run timeout is logged and left out.
     */
    public Map<String, InsightsRunResult> runAll(Iterable<String> tenantIds, BriefingType type, Instant asOf) {
        TreeSet<String> tenants = new TreeSet<>();
        tenantIds.forEach(tenants::add);

        Map<String, Future<InsightsRunResult>> submitted = new LinkedHashMap<>();
        for (String tenantId : tenants) {
            submitted.put(tenantId, executor.submit(() -> runTenant(tenantId, type, asOf)));
        }

        Map<String, InsightsRunResult> results = new LinkedHashMap<>();
        long deadline = System.nanoTime() + runTimeout.toNanos();
        for (Map.Entry<String, Future<InsightsRunResult>> entry : submitted.entrySet()) {
            String tenantId = entry.getKey();
            Future<InsightsRunResult> future = entry.getValue();
            try {
                results.put(tenantId, future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Tenant run: tenant={} type={} exceeded {} and was cancelled", tenantId, type, runTimeout);
                auditLogger.recordFailure(tenantId, type.name(), ex);
            } catch (ExecutionException ex) {
                auditLogger.recordFailure(tenantId, type.name(), ex.getCause());
                log.warn("Tenant run: tenant={} type={} failed", tenantId, type, ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                submitted.values().forEach(pending -> pending.cancel(true));
                log.warn("Tenant run: interrupted after {} of {} tenants", results.size(), submitted.size());
                break;
            }
        }
        return results;
    }
}
