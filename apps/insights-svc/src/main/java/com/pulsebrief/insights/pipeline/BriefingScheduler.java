package com.pulsebrief.insights.pipeline;

import com.pulsebrief.insights.briefing.BriefingDeliverer;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.model.BriefingType;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class BriefingScheduler {

    private static final Logger log = LoggerFactory.getLogger(BriefingScheduler.class);

    private final TenantRunCoordinator coordinator;
    private final KpiFeed kpiFeed;
    private final BriefingDeliverer deliverer;
    private final Clock clock;

    public BriefingScheduler(TenantRunCoordinator coordinator, KpiFeed kpiFeed, BriefingDeliverer deliverer, Clock clock) {
        this.coordinator = coordinator;
        this.kpiFeed = kpiFeed;
        this.deliverer = deliverer;
        this.clock = clock;
    }

    @Scheduled(cron = "${insights.schedule.morning-cron:0 0 7 * * *}", zone = "${insights.schedule.zone:UTC}")
    public void morning() {
        runAndDeliver(BriefingType.MORNING);
    }

    @Scheduled(cron = "${insights.schedule.evening-cron:0 0 18 * * *}", zone = "${insights.schedule.zone:UTC}")
    public void evening() {
        runAndDeliver(BriefingType.EVENING);
    }

    @Scheduled(cron = "${insights.schedule.weekly-cron:0 0 8 * * MON}", zone = "${insights.schedule.zone:UTC}")
    public void weekly() {
        runAndDeliver(BriefingType.WEEKLY);
    }

    /** Returns the number of briefings delivered. */
    public int runAndDeliver(BriefingType type) {
        Map<String, InsightsRunResult> results = coordinator.runAll(kpiFeed.tenants(), type, clock.instant());
        int delivered = 0;
        for (InsightsRunResult result : results.values()) {
            try {
                deliverer.deliver(result.briefing());
                delivered++;
            } catch (RuntimeException ex) {
                log.warn("Briefing scheduler: delivery failed for tenant={} briefing={}",
                        result.tenantId(), result.briefing().id(), ex);
            }
        }
        log.info("Briefing scheduler: type={} tenants={} delivered={}", type, results.size(), delivered);
        return delivered;
    }
}
