package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.anomaly.PreparedSeries;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.CorrelationEdge;
import com.pulsebrief.insights.stats.Statistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the directed dependency graph. For every ordered KPI pair the lag with the
 * strongest cross-correlation is searched within the configured window; the edge is kept
 * only when that correlation and the lagged-causality test both pass.
 */
@Component
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);
    private static final int TOP_CENTRAL = 3;

    private final LaggedCausalityTest causalityTest;
    private final CentralityCalculator centrality;
    private final InsightsProperties.Correlation settings;

    public CorrelationEngine(LaggedCausalityTest causalityTest, CentralityCalculator centrality, InsightsProperties properties) {
        this.causalityTest = causalityTest;
        this.centrality = centrality;
        this.settings = properties.correlation();
    }

    public KpiGraph buildGraph(Map<String, PreparedSeries> seriesByKpi) {
        Map<String, PreparedSeries> ordered = new TreeMap<>(seriesByKpi);
        KpiGraph.Builder builder = KpiGraph.builder(settings.maxLag());
        ordered.keySet().forEach(builder::addNode);
        for (PreparedSeries source : ordered.values()) {
            for (PreparedSeries target : ordered.values()) {
                if (source.kpiName().equals(target.kpiName())) {
                    continue;
                }
                try {
                    evaluatePair(source, target).ifPresent(builder::addEdge);
                } catch (RuntimeException ex) {
                    log.warn("Correlation: pair {} -> {} skipped: {}", source.kpiName(), target.kpiName(), ex.getMessage());
                }
            }
        }
        KpiGraph graph = builder.build();
        log.debug("Correlation: {} nodes, {} edges", graph.nodeCount(), graph.edges().size());
        return graph;
    }

    public DependencyAnalysis analyze(KpiGraph graph) {
        Map<String, Double> pageRank = centrality.pageRank(graph);
        Map<String, Double> betweenness = centrality.betweenness(graph);
        return new DependencyAnalysis(
                graph.nodes(),
                graph.edges(),
                pageRank,
                betweenness,
                top(pageRank, false),
                top(betweenness, true));
    }

    Optional<CorrelationEdge> evaluatePair(PreparedSeries source, PreparedSeries target) {
        AlignedSeries aligned = AlignedSeries.of(source, target);
        if (aligned.length() < settings.minOverlap()) {
            return Optional.empty();
        }
        double[] cause = aligned.left();
        double[] effect = aligned.right();
        int bestLag = -1;
        double bestCorrelation = 0d;
        int maxLag = Math.min(settings.maxLag(), aligned.length() - settings.minOverlap() / 2);
        for (int lag = settings.minLag(); lag <= maxLag; lag++) {
            double correlation = Statistics.laggedCorrelation(cause, effect, lag);
            if (Math.abs(correlation) > Math.abs(bestCorrelation)) {
                bestCorrelation = correlation;
                bestLag = lag;
            }
        }
        if (bestLag < 0 || Math.abs(bestCorrelation) < settings.minCorrelation()) {
            return Optional.empty();
        }
        double pValue = causalityTest.pValue(cause, effect, bestLag, settings.grangerOrder());
        if (pValue >= settings.significance()) {
            return Optional.empty();
        }
        int overlap = aligned.length() - bestLag;
        double[] leading = Arrays.copyOfRange(cause, 0, overlap);
        double[] following = Arrays.copyOfRange(effect, bestLag, bestLag + overlap);
        return Optional.of(new CorrelationEdge(
                source.kpiName(),
                target.kpiName(),
                bestLag,
                Statistics.clamp(bestCorrelation, -1d, 1d),
                Statistics.pearson(leading, following),
                Statistics.spearman(leading, following),
                pValue,
                true));
    }

    private List<String> top(Map<String, Double> scores, boolean positiveOnly) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(scores.entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return entries.stream()
                .filter(entry -> !positiveOnly || entry.getValue() > 0d)
                .limit(TOP_CENTRAL)
                .map(Map.Entry::getKey)
                .toList();
    }
}
