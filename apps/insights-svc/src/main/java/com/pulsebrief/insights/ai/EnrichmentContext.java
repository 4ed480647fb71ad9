package com.pulsebrief.insights.ai;

import java.util.List;

/**
 * Tenant facts given to the enrichment provider alongside a candidate. {@code evidence}
 * holds short sentences such as anomaly and root-cause explanations from the same run.
 */
public record EnrichmentContext(String tenantId, String companyStage, List<String> focusAreas, List<String> evidence) {

    public EnrichmentContext {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
