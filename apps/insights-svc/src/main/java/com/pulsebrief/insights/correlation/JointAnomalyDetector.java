package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.anomaly.IsolationForest;
import com.pulsebrief.insights.anomaly.PreparedSeries;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.JointAnomaly;
import com.pulsebrief.insights.stats.Statistics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores the latest common timestamp across all KPIs with an isolation forest over
 * per-KPI robust z-scores, then attributes the score by leave-one-out: each KPI's
 * component is reset to its median and the drop in score is its contribution.
 */
@Component
public class JointAnomalyDetector {

    private static final int MIN_ROWS = 16;

    private final double threshold;
    private final int trees;
    private final int sampleSize;

    @Autowired

    public JointAnomalyDetector(InsightsProperties properties) {
        this(properties.correlation().jointAnomalyThreshold(),
                properties.detection().forestTrees(),
                properties.detection().forestSampleSize());
    }

    JointAnomalyDetector(double threshold, int trees, int sampleSize) {
        this.threshold = threshold;
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    public Optional<JointAnomaly> detect(Map<String, PreparedSeries> seriesByKpi) {
        if (seriesByKpi.size() < 2) {
            return Optional.empty();
        }
        List<String> kpis = new ArrayList<>(new TreeMap<>(seriesByKpi).keySet());
        TreeSet<Instant> common = null;
        List<Map<Instant, Double>> lookups = new ArrayList<>();
        for (String kpi : kpis) {
            PreparedSeries series = seriesByKpi.get(kpi);
            Map<Instant, Double> lookup = new HashMap<>();
            for (int i = 0; i < series.length(); i++) {
                lookup.put(series.timestampAt(i), series.valueAt(i));
            }
            lookups.add(lookup);
            common = common == null ? new TreeSet<>(lookup.keySet()) : retain(common, lookup);
        }
        if (common == null || common.size() < MIN_ROWS) {
            return Optional.empty();
        }

        List<Instant> timestamps = new ArrayList<>(common);
        int rows = timestamps.size();
        double[][] matrix = new double[rows][kpis.size()];
        for (int k = 0; k < kpis.size(); k++) {
            double[] column = new double[rows];
            for (int r = 0; r < rows; r++) {
                column[r] = lookups.get(k).get(timestamps.get(r));
            }
            double median = Statistics.median(column);
            double mad = Statistics.medianAbsoluteDeviation(column) * Statistics.MAD_TO_SIGMA;
            double scale = mad > 0d ? mad : Math.max(Statistics.stdDev(column), 1e-9d);
            for (int r = 0; r < rows; r++) {
                matrix[r][k] = (column[r] - median) / scale;
            }
        }

        double[][] training = new double[rows - 1][];
        System.arraycopy(matrix, 0, training, 0, rows - 1);
        long seed = String.join("|", kpis).hashCode();
        IsolationForest forest = new IsolationForest(trees, sampleSize, seed).fit(training);
        double[] latest = matrix[rows - 1];
        double base = forest.score(latest);
        boolean anomalous = base >= threshold;
        List<JointAnomaly.Contribution> contributions = anomalous ? attribute(forest, latest, base, kpis) : List.of();
        return Optional.of(new JointAnomaly(timestamps.get(rows - 1), base, anomalous, contributions));
    }

    List<JointAnomaly.Contribution> attribute(IsolationForest forest, double[] latest, double base, List<String> kpis) {
        double[] drops = new double[kpis.size()];
        double total = 0d;
        for (int k = 0; k < kpis.size(); k++) {
            double[] perturbed = latest.clone();
            perturbed[k] = 0d;
            drops[k] = Math.max(0d, base - forest.score(perturbed));
            total += drops[k];
        }
        List<JointAnomaly.Contribution> contributions = new ArrayList<>();
        for (int k = 0; k < kpis.size(); k++) {
            double share = total == 0d ? 0d : drops[k] / total;
            if (share > 0d) {
                contributions.add(new JointAnomaly.Contribution(kpis.get(k), share));
            }
        }
        contributions.sort((left, right) -> {
            int byShare = Double.compare(right.share(), left.share());
            return byShare != 0 ? byShare : left.kpiName().compareTo(right.kpiName());
        });
        return contributions;
    }

    private TreeSet<Instant> retain(TreeSet<Instant> common, Map<Instant, Double> lookup) {
        common.retainAll(lookup.keySet());
        return common;
    }
}
