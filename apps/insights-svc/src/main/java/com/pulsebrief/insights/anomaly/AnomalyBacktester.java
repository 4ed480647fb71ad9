package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Measures detector recall and false-positive rate by injecting known anomalies into a
 * clean series and replaying detection point by point.
 */
@Component
public class AnomalyBacktester {

    private static final Logger log = LoggerFactory.getLogger(AnomalyBacktester.class);

    private final AnomalyDetector detector;
    private final SeriesPreparer preparer;
    private final SeasonalModelCache modelCache;
    private final InsightsProperties.Detection settings;

    public AnomalyBacktester(AnomalyDetector detector, SeriesPreparer preparer, SeasonalModelCache modelCache,
                             InsightsProperties properties) {
        this.detector = detector;
        this.preparer = preparer;
        this.modelCache = modelCache;
        this.settings = properties.detection();
    }

    public BacktestReport run(KpiSeries clean, List<Injection> injections, int warmup, double threshold) {
        List<KpiPoint> points = new ArrayList<>(clean.points());
        Set<Integer> truth = new HashSet<>();
        Set<Integer> excluded = new HashSet<>();
        int period = clean.frequency().seasonalPeriod();
        for (Injection injection : injections) {
            injection.applyTo(points);
            truth.add(injection.index());
            if (injection.kind() == Kind.LEVEL_SHIFT) {
                for (int i = injection.index() + 1; i <= injection.index() + 3 * period; i++) {
                    excluded.add(i);
                }
            }
        }

        String tenant = "backtest-" + UUID.randomUUID();
        Instant asOf = points.get(points.size() - 1).timestamp();
        PreparedSeries series = preparer.prepare(new KpiSeries(clean.kpiName(), points, clean.frequency()), asOf);
        int truePositives = 0;
        int falsePositives = 0;
        int negatives = 0;
        try {
            for (int index = Math.max(1, warmup); index < series.length(); index++) {
                DetectionContext context = new DetectionContext(tenant, series, index, CrossKpiSnapshot.empty(),
                        settings.populationPriorCv(), asOf);
                boolean flagged = detector.detect(context, threshold).isPresent();
                if (excluded.contains(index)) {
                    // the detector still sees the point so its model adapts to the new level
                    continue;
                }
                if (truth.contains(index)) {
                    truePositives += flagged ? 1 : 0;
                } else {
                    negatives++;
                    falsePositives += flagged ? 1 : 0;
                }
            }
        } finally {
            modelCache.evictTenant(tenant);
        }
        long evaluatedTruth = truth.stream().filter(index -> index >= warmup).count();
        double recall = evaluatedTruth == 0 ? 1d : (double) truePositives / evaluatedTruth;
        double falsePositiveRate = negatives == 0 ? 0d : (double) falsePositives / negatives;
        BacktestReport report = new BacktestReport(truePositives, (int) evaluatedTruth - truePositives, falsePositives,
                negatives - falsePositives, recall, falsePositiveRate,
                recall >= settings.backtestMinRecall() && falsePositiveRate <= settings.backtestMaxFalsePositiveRate());
        log.info("Anomaly backtest: kpi={} recall={} fpr={} meetsTargets={}", clean.kpiName(),
                String.format(Locale.ROOT, "%.3f", recall), String.format(Locale.ROOT, "%.3f", falsePositiveRate), report.meetsTargets());
        return report;
    }

    public enum Kind {
        SPIKE,
        DROP,
        LEVEL_SHIFT
    }

    /**
     * {@code magnitude} is relative: 0.4 means +40% for a spike, -40% for a drop, and
     * a level shift by {@code magnitude} (signed) from {@code index} onward.
     */
    public record Injection(int index, Kind kind, double magnitude) {

        void applyTo(List<KpiPoint> points) {
            switch (kind) {
                case SPIKE -> scale(points, index, 1d + Math.abs(magnitude));
                case DROP -> scale(points, index, 1d - Math.abs(magnitude));
                case LEVEL_SHIFT -> {
                    for (int i = index; i < points.size(); i++) {
                        scale(points, i, 1d + magnitude);
                    }
                }
            }
        }

        private static void scale(List<KpiPoint> points, int i, double factor) {
            KpiPoint point = points.get(i);
            points.set(i, new KpiPoint(point.timestamp(), point.value() == null ? null : point.value() * factor));
        }
    }

    public record BacktestReport(
            int truePositives,
            int falseNegatives,
            int falsePositives,
            int trueNegatives,
            double recall,
            double falsePositiveRate,
            boolean meetsTargets
    ) {
    }
}
