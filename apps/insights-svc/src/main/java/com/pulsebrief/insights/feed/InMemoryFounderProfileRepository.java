package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.FounderProfile;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryFounderProfileRepository implements FounderProfileRepository {

    private final Map<String, FounderProfile> storage = new ConcurrentHashMap<>();

    @Override
    public FounderProfile save(FounderProfile profile) {
        storage.put(profile.tenantId(), profile);
        return profile;
    }

    @Override
    public Optional<FounderProfile> findByTenant(String tenantId) {
        return Optional.ofNullable(storage.get(tenantId));
    }
}
