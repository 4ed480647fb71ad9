package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ranked action for a founder. {@code sourceKey} is the rule id or pattern name the
 * calibration statistics are keyed by. Pinned recommendations come from critical rules
 * and survive the category cap and truncation.
 */
public record Recommendation(
        String id,
        String tenantId,
        String category,
        String title,
        String description,
        String rationale,
        double priorityScore,
        double urgency,
        double impact,
        double feasibility,
        double confidence,
        PriorityLevel level,
        List<String> actionItems,
        RecommendationSource source,
        String sourceKey,
        RecommendationStatus status,
        boolean pinned,
        Instant createdAt
) {

    public Recommendation {
        if (priorityScore < 0d || priorityScore > 100d) {
            throw new IllegalArgumentException("priorityScore must be within [0,100]: " + priorityScore);
        }
        if (confidence < 0d || confidence > 1d) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
        status = status == null ? RecommendationStatus.PENDING : status;
    }

    public Recommendation withStatus(RecommendationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Recommendation " + id + " cannot move from " + status + " to " + next);
        }
        return new Recommendation(id, tenantId, category, title, description, rationale, priorityScore, urgency,
                impact, feasibility, confidence, level, actionItems, source, sourceKey, next, pinned, createdAt);
    }

    /** Copy carrying generated rationale and extra steps; ranking fields are untouched. */
    public Recommendation withEnrichment(String enrichedRationale, List<String> extraActionItems) {
        List<String> merged = new ArrayList<>(actionItems);
        for (String item : extraActionItems) {
            if (item != null && !item.isBlank() && !merged.contains(item)) {
                merged.add(item);
            }
        }
        return new Recommendation(id, tenantId, category, title, description, enrichedRationale, priorityScore,
                urgency, impact, feasibility, confidence, level, merged, RecommendationSource.ENRICHED, sourceKey,
                status, pinned, createdAt);
    }
}
