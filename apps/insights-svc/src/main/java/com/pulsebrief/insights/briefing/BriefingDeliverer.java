package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Briefing;

/**
 * Channel-agnostic hand-off of a finished briefing.
 */
public interface BriefingDeliverer {

    void deliver(Briefing briefing);
}
