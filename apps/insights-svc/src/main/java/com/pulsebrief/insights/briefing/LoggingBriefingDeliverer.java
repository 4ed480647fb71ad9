package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Briefing;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingBriefingDeliverer implements BriefingDeliverer {

    private static final Logger log = LoggerFactory.getLogger(LoggingBriefingDeliverer.class);

    @Override
    public void deliver(Briefing briefing) {
        log.info("Briefing delivered: id={} tenant={} type={} items={} sections={} readMinutes={}",
                briefing.id(), briefing.tenantId(), briefing.type(), briefing.itemCount(), briefing.sections().size(),
                String.format(Locale.ROOT, "%.1f", briefing.estimatedReadMinutes()));
        if (briefing.dataQualityNote() != null) {
            log.info("Briefing {} data quality note: {}", briefing.id(), briefing.dataQualityNote());
        }
    }
}
