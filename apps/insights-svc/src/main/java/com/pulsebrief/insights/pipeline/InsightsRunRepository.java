package com.pulsebrief.insights.pipeline;

import java.util.Optional;

public interface InsightsRunRepository {

    InsightsRunResult save(InsightsRunResult result);

    Optional<InsightsRunResult> findLatest(String tenantId);
}
