package com.pulsebrief.insights.ai;

import java.util.List;

public record EnrichmentOutcome(boolean successful, String rationale, List<String> actionItems, String failureReason) {

    public EnrichmentOutcome {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    public static EnrichmentOutcome success(String rationale, List<String> actionItems) {
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("successful enrichment needs a rationale");
        }
        return new EnrichmentOutcome(true, rationale, actionItems, null);
    }

    public static EnrichmentOutcome failure(String reason) {
        return new EnrichmentOutcome(false, null, List.of(), reason);
    }
}
