package com.pulsebrief.insights.recommendation;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RecommendationExpiryJob {

    private static final Logger log = LoggerFactory.getLogger(RecommendationExpiryJob.class);

    private final RecommendationService service;
    private final Clock clock;

    public RecommendationExpiryJob(RecommendationService service, Clock clock) {
        this.service = service;
        this.clock = clock;
    }

    @Scheduled(cron = "${insights.schedule.expiry-cron:0 15 3 * * *}", zone = "${insights.schedule.zone:UTC}")
    public void expireOnSchedule() {
        expire("scheduled");
    }

    public int expireNow() {
        return expire("inline");
    }

    private int expire(String source) {
        int expired = service.expirePending(clock.instant());
        if (expired > 0) {
            log.info("Recommendation expiry ({}): {} pending recommendations expired", source, expired);
        } else {
            log.debug("Recommendation expiry ({}): nothing to expire", source);
        }
        return expired;
    }
}
