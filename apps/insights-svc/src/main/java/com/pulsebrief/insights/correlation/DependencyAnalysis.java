package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.model.CorrelationEdge;
import java.util.List;
import java.util.Map;

/**
 * Serialisable view of a run's dependency graph with its centrality scores.
 */
public record DependencyAnalysis(
        List<String> nodes,
        List<CorrelationEdge> edges,
        Map<String, Double> pageRank,
        Map<String, Double> betweenness,
        List<String> dominantKpis,
        List<String> bridgingKpis
) {

    public DependencyAnalysis {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        pageRank = Map.copyOf(pageRank);
        betweenness = Map.copyOf(betweenness);
        dominantKpis = List.copyOf(dominantKpis);
        bridgingKpis = List.copyOf(bridgingKpis);
    }

    public static DependencyAnalysis empty() {
        return new DependencyAnalysis(List.of(), List.of(), Map.of(), Map.of(), List.of(), List.of());
    }
}
