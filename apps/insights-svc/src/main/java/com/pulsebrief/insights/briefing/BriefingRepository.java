package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Briefing;
import java.time.Instant;
import java.util.Optional;

public interface BriefingRepository {

    Briefing save(Briefing briefing);

    Optional<Briefing> findById(String id);

    Optional<Briefing> findLatest(String tenantId);

    /** Read state lives beside the briefing, which stays immutable. */
    void markRead(String briefingId, Instant readAt);

    Optional<Instant> readAt(String briefingId);
}
