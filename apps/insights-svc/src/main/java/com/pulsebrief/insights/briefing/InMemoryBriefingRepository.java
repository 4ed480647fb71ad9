package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Briefing;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBriefingRepository implements BriefingRepository {

    private final Map<String, Briefing> storage = new ConcurrentHashMap<>();
    private final Map<String, String> latestByTenant = new ConcurrentHashMap<>();
    private final Map<String, Instant> readState = new ConcurrentHashMap<>();

    @Override
    public Briefing save(Briefing briefing) {
        storage.put(briefing.id(), briefing);
        latestByTenant.merge(briefing.tenantId(), briefing.id(), (current, candidate) -> {
            Briefing existing = storage.get(current);
            return existing == null || !briefing.generatedAt().isBefore(existing.generatedAt()) ? candidate : current;
        });
        return briefing;
    }

    @Override
    public Optional<Briefing> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Optional<Briefing> findLatest(String tenantId) {
        return Optional.ofNullable(latestByTenant.get(tenantId)).map(storage::get);
    }

    @Override
    public void markRead(String briefingId, Instant readAt) {
        readState.putIfAbsent(briefingId, readAt);
    }

    @Override
    public Optional<Instant> readAt(String briefingId) {
        return Optional.ofNullable(readState.get(briefingId));
    }
}
