package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.AnomalyDirection;
import com.pulsebrief.insights.model.CorrelationEdge;
import com.pulsebrief.insights.model.RootCauseFinding;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Walks incoming edges from an anomalous KPI looking for predecessor anomalies that
 * happened about one edge-lag earlier. Candidate confidence is the product of
 * |correlation| and predecessor anomaly score along the path.
 */
@Component
public class RootCauseTracer {

    private static final int EXPLAINED_CAUSES = 2;

    private final int maxDepth;

    @Autowired

    public RootCauseTracer(InsightsProperties properties) {
        this(properties.correlation().rootCauseDepth());
    }

    RootCauseTracer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Traces every anomaly in {@code targets}. Upstream causes are looked up in
     * {@code history}, which must reach back at least the longest traceable lag.
     */
    public List<RootCauseFinding> traceAll(
            KpiGraph graph,
            List<Anomaly> targets,
            List<Anomaly> history,
            Function<String, Duration> stepOf) {
        List<RootCauseFinding> findings = new ArrayList<>();
        for (Anomaly anomaly : targets) {
            RootCauseFinding finding = trace(graph, history, anomaly, stepOf);
            if (!finding.candidates().isEmpty()) {
                findings.add(finding);
            }
        }
        return findings;
    }

    public RootCauseFinding trace(KpiGraph graph, List<Anomaly> anomalies, Anomaly target, Function<String, Duration> stepOf) {
        Map<String, RootCauseFinding.Candidate> best = new HashMap<>();
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(target.kpiName(), target.timestamp(), List.of(target.kpiName()), 1d, 0));
        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.path().size() - 1 >= maxDepth) {
                continue;
            }
            for (CorrelationEdge edge : graph.incoming(current.kpi())) {
                String predecessor = edge.sourceKpi();
                if (current.path().contains(predecessor)) {
                    continue;
                }
                Duration step = stepOf.apply(predecessor);
                Instant expected = current.timestamp().minus(step.multipliedBy(edge.lag()));
                Optional<Anomaly> cause = nearest(anomalies, predecessor, expected, step);
                if (cause.isEmpty()) {
                    continue;
                }
                double confidence = current.confidence() * Math.abs(edge.strength()) * cause.get().score();
                List<String> path = new ArrayList<>();
                path.add(predecessor);
                path.addAll(current.path());
                RootCauseFinding.Candidate candidate = new RootCauseFinding.Candidate(
                        predecessor,
                        path,
                        current.totalLag() + edge.lag(),
                        cause.get().timestamp(),
                        cause.get().direction(),
                        confidence);
                best.merge(predecessor, candidate, (left, right) -> left.confidence() >= right.confidence() ? left : right);
                queue.add(new Frontier(predecessor, cause.get().timestamp(), path, confidence, candidate.totalLag()));
            }
        }
        List<RootCauseFinding.Candidate> ranked = best.values().stream()
                .sorted(Comparator.comparingDouble(RootCauseFinding.Candidate::confidence).reversed()
                        .thenComparing(RootCauseFinding.Candidate::kpiName))
                .toList();
        return new RootCauseFinding(target.kpiName(), target.timestamp(), ranked, explain(target, ranked));
    }

    private Optional<Anomaly> nearest(List<Anomaly> anomalies, String kpi, Instant expected, Duration tolerance) {
        return anomalies.stream()
                .filter(anomaly -> anomaly.kpiName().equals(kpi))
                .filter(anomaly -> Duration.between(anomaly.timestamp(), expected).abs().compareTo(tolerance) <= 0)
                .max(Comparator.comparingDouble(Anomaly::score)
                        .thenComparing(Anomaly::timestamp));
    }

    private String explain(Anomaly target, List<RootCauseFinding.Candidate> ranked) {
        if (ranked.isEmpty()) {
            return "No correlated upstream anomaly found for " + target.kpiName() + ".";
        }
        StringBuilder text = new StringBuilder("Likely driven by ");
        int shown = Math.min(EXPLAINED_CAUSES, ranked.size());
        for (int i = 0; i < shown; i++) {
            RootCauseFinding.Candidate candidate = ranked.get(i);
            if (i > 0) {
                text.append(" and ");
            }
            text.append(candidate.direction() == AnomalyDirection.DOWN ? "a drop in " : "a rise in ")
                    .append(candidate.kpiName())
                    .append(' ')
                    .append(candidate.totalLag())
                    .append(candidate.totalLag() == 1 ? " period" : " periods")
                    .append(" earlier (confidence ")
                    .append(String.format(Locale.ROOT, "%.2f", candidate.confidence()))
                    .append(')');
        }
        return text.append('.').toString();
    }

    private record Frontier(String kpi, Instant timestamp, List<String> path, double confidence, int totalLag) {
    }
}
