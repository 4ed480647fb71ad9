package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.model.CorrelationEdge;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * PageRank (weighted by |strength|) finds dominant KPIs; Brandes betweenness on the
 * unweighted directed graph finds bridging ones.
 */
@Component
public class CentralityCalculator {

    static final double DAMPING = 0.85d;
    private static final double TOLERANCE = 1e-9d;
    private static final int MAX_ITERATIONS = 100;

    public Map<String, Double> pageRank(KpiGraph graph) {
        int n = graph.nodeCount();
        Map<String, Double> result = new LinkedHashMap<>();
        if (n == 0) {
            return result;
        }
        double[] outWeight = new double[n];
        for (CorrelationEdge edge : graph.edges()) {
            outWeight[graph.indexOf(edge.sourceKpi())] += Math.abs(edge.strength());
        }
        double[] rank = new double[n];
        Arrays.fill(rank, 1d / n);
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double danglingMass = 0d;
            for (int i = 0; i < n; i++) {
                if (outWeight[i] == 0d) {
                    danglingMass += rank[i];
                }
            }
            double[] next = new double[n];
            Arrays.fill(next, (1d - DAMPING) / n + DAMPING * danglingMass / n);
            for (CorrelationEdge edge : graph.edges()) {
                int source = graph.indexOf(edge.sourceKpi());
                int target = graph.indexOf(edge.targetKpi());
                next[target] += DAMPING * rank[source] * Math.abs(edge.strength()) / outWeight[source];
            }
            double delta = 0d;
            for (int i = 0; i < n; i++) {
                delta += Math.abs(next[i] - rank[i]);
            }
            rank = next;
            if (delta < TOLERANCE) {
                break;
            }
        }
        for (int i = 0; i < n; i++) {
            result.put(graph.nodes().get(i), rank[i]);
        }
        return result;
    }

    /**
     * Normalised betweenness, divided by (n-1)(n-2) for directed graphs.
     */
    public Map<String, Double> betweenness(KpiGraph graph) {
        int n = graph.nodeCount();
        double[] centrality = new double[n];
        for (int s = 0; s < n; s++) {
            Deque<Integer> stack = new ArrayDeque<>();
            List<List<Integer>> predecessors = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                predecessors.add(new ArrayList<>());
            }
            double[] sigma = new double[n];
            int[] distance = new int[n];
            Arrays.fill(distance, -1);
            sigma[s] = 1d;
            distance[s] = 0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                stack.push(v);
                for (int edgeIndex : graph.outgoingIndices(v)) {
                    int w = graph.indexOf(graph.edge(edgeIndex).targetKpi());
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }
            double[] dependency = new double[n];
            while (!stack.isEmpty()) {
                int w = stack.pop();
                for (int v : predecessors.get(w)) {
                    dependency[v] += sigma[v] / sigma[w] * (1d + dependency[w]);
                }
                if (w != s) {
                    centrality[w] += dependency[w];
                }
            }
        }
        double normaliser = n > 2 ? (double) (n - 1) * (n - 2) : 1d;
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            result.put(graph.nodes().get(i), centrality[i] / normaliser);
        }
        return result;
    }
}
