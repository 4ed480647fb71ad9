package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.List;

public record RootCauseFinding(
        String kpiName,
        Instant anomalyTimestamp,
        List<Candidate> candidates,
        String explanation
) {

    public RootCauseFinding {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * An upstream KPI anomaly reached through {@code path} (cause first), with the summed
     * lag along it.
     */
    public record Candidate(
            String kpiName,
            List<String> path,
            int totalLag,
            Instant anomalyTimestamp,
            AnomalyDirection direction,
            double confidence
    ) {
        public Candidate {
            path = path == null ? List.of() : List.copyOf(path);
        }
    }
}
