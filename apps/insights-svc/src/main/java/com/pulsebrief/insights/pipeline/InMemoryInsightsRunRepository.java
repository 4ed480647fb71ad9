package com.pulsebrief.insights.pipeline;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryInsightsRunRepository implements InsightsRunRepository {

    private final Map<String, InsightsRunResult> latest = new ConcurrentHashMap<>();

    @Override
    public InsightsRunResult save(InsightsRunResult result) {
        latest.merge(result.tenantId(), result,
                (current, candidate) -> candidate.asOf().isBefore(current.asOf()) ? current : candidate);
        return result;
    }

    @Override
    public Optional<InsightsRunResult> findLatest(String tenantId) {
        return Optional.ofNullable(latest.get(tenantId));
    }
}
