package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.FounderProfile;
import java.util.Optional;

public interface FounderProfileRepository {

    FounderProfile save(FounderProfile profile);

    Optional<FounderProfile> findByTenant(String tenantId);

    default FounderProfile findOrDefault(String tenantId) {
        return findByTenant(tenantId).orElseGet(() -> FounderProfile.defaultFor(tenantId));
    }
}
