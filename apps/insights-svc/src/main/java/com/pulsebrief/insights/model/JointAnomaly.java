package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.List;

/**
 * Multi-KPI anomaly at a timestamp with per-KPI shares of the score (sum to 1 when
 * anything contributed).
 */
public record JointAnomaly(Instant timestamp, double score, boolean anomalous, List<Contribution> contributions) {

    public JointAnomaly {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public record Contribution(String kpiName, double share) {
    }
}
