package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.model.CorrelationEdge;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed KPI dependency graph stored as flat node and edge lists addressed by index.
 * Built once through {@link Builder} and read-only afterwards, so concurrent readers need
 * no locking.
 */
public final class KpiGraph {

    private final List<String> nodes;
    private final Map<String, Integer> nodeIndex;
    private final List<CorrelationEdge> edges;
    private final List<List<Integer>> incoming;
    private final List<List<Integer>> outgoing;
    private final int maxLag;

    private KpiGraph(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.nodeIndex = Map.copyOf(builder.nodeIndex);
        this.edges = List.copyOf(builder.edges);
        List<List<Integer>> in = new ArrayList<>();
        List<List<Integer>> out = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            in.add(List.copyOf(builder.incoming.get(i)));
            out.add(List.copyOf(builder.outgoing.get(i)));
        }
        this.incoming = Collections.unmodifiableList(in);
        this.outgoing = Collections.unmodifiableList(out);
        this.maxLag = builder.maxLag;
    }

    public static Builder builder(int maxLag) {
        return new Builder(maxLag);
    }

    public List<String> nodes() {
        return nodes;
    }

    public List<CorrelationEdge> edges() {
        return edges;
    }

    public int maxLag() {
        return maxLag;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int indexOf(String kpi) {
        Integer index = nodeIndex.get(kpi);
        return index == null ? -1 : index;
    }

    public CorrelationEdge edge(int edgeIndex) {
        return edges.get(edgeIndex);
    }

    public List<CorrelationEdge> incoming(String kpi) {
        int index = indexOf(kpi);
        return index < 0 ? List.of() : incoming.get(index).stream().map(edges::get).toList();
    }

    public List<CorrelationEdge> outgoing(String kpi) {
        int index = indexOf(kpi);
        return index < 0 ? List.of() : outgoing.get(index).stream().map(edges::get).toList();
    }

    List<Integer> outgoingIndices(int node) {
        return outgoing.get(node);
    }

    /**
     * KPIs whose movement precedes {@code kpi}: strongest first, then shorter lag, then
     * name.
     */
    public List<CorrelationEdge> leadingIndicators(String kpi) {
        return incoming(kpi).stream()
                .sorted(Comparator.comparing((CorrelationEdge edge) -> Math.abs(edge.strength())).reversed()
                        .thenComparingInt(CorrelationEdge::lag)
                        .thenComparing(CorrelationEdge::sourceKpi))
                .toList();
    }

    public static final class Builder {

        private final int maxLag;
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nodeIndex = new HashMap<>();
        private final List<CorrelationEdge> edges = new ArrayList<>();
        private final List<List<Integer>> incoming = new ArrayList<>();
        private final List<List<Integer>> outgoing = new ArrayList<>();

        private Builder(int maxLag) {
            if (maxLag < 0) {
                throw new IllegalArgumentException("maxLag must be non-negative");
            }
            this.maxLag = maxLag;
        }

        public Builder addNode(String kpi) {
            nodeIndex.computeIfAbsent(kpi, key -> {
                nodes.add(key);
                incoming.add(new ArrayList<>());
                outgoing.add(new ArrayList<>());
                return nodes.size() - 1;
            });
            return this;
        }

        public Builder addEdge(CorrelationEdge edge) {
            if (edge.lag() > maxLag) {
                throw new IllegalArgumentException("lag " + edge.lag() + " exceeds bound " + maxLag);
            }
            Integer source = nodeIndex.get(edge.sourceKpi());
            Integer target = nodeIndex.get(edge.targetKpi());
            if (source == null || target == null) {
                throw new IllegalArgumentException("edge references unknown node: " + edge.sourceKpi() + " -> " + edge.targetKpi());
            }
            boolean duplicate = outgoing.get(source).stream()
                    .anyMatch(existing -> edges.get(existing).targetKpi().equals(edge.targetKpi()));
            if (duplicate) {
                throw new IllegalArgumentException("duplicate edge " + edge.sourceKpi() + " -> " + edge.targetKpi());
            }
            edges.add(edge);
            int edgeIndex = edges.size() - 1;
            outgoing.get(source).add(edgeIndex);
            incoming.get(target).add(edgeIndex);
            return this;
        }

        public KpiGraph build() {
            return new KpiGraph(this);
        }
    }
}
