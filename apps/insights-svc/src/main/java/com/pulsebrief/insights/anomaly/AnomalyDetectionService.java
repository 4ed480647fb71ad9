package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.stats.Statistics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the detector ensemble over every KPI of a tenant. Each KPI is isolated: a failure
 * is reported as a data-quality issue and the remaining KPIs carry on.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);
    private static final String STAGE = "anomaly_detection";
    private static final Comparator<Anomaly> RANKING = Comparator.comparing(Anomaly::score).reversed()
            .thenComparing(Anomaly::timestamp, Comparator.reverseOrder())
            .thenComparing(Anomaly::kpiName);

    private final AnomalyDetector detector;
    private final AdaptiveThresholdStore thresholdStore;
    private final InsightsProperties.Detection settings;
    private final int traceLookback;

    public AnomalyDetectionService(AnomalyDetector detector, AdaptiveThresholdStore thresholdStore, InsightsProperties properties) {
        this.detector = detector;
        this.thresholdStore = thresholdStore;
        this.settings = properties.detection();
        // deepest traceable path plus the one-step matching tolerance
        this.traceLookback = properties.correlation().maxLag() * properties.correlation().rootCauseDepth() + 1;
    }

    public AnomalyReport detect(String tenantId, Map<String, PreparedSeries> seriesByKpi, FounderProfile profile, Instant asOf) {
        CrossKpiSnapshot snapshot = buildSnapshot(seriesByKpi);
        double priorCv = populationPriorCv(seriesByKpi);
        List<Anomaly> anomalies = new ArrayList<>();
        List<Anomaly> history = new ArrayList<>();
        List<DataQualityIssue> issues = new ArrayList<>();

        for (PreparedSeries series : new TreeMap<>(seriesByKpi).values()) {
            try {
                if (series.stale()) {
                    issues.add(new DataQualityIssue(series.kpiName(), STAGE,
                            "latest value is from " + series.lastTimestamp() + ", confidence reduced"));
                }
                List<Anomaly> found = detectSeries(tenantId, series, snapshot, priorCv,
                        thresholdFor(tenantId, series.kpiName(), profile), asOf, settings.evaluationWindow() + traceLookback);
                Instant reportedFrom = series.timestampAt(evaluationStart(series, settings.evaluationWindow()));
                history.addAll(found);
                found.stream()
                        .filter(anomaly -> !anomaly.timestamp().isBefore(reportedFrom))
                        .forEach(anomalies::add);
            } catch (RuntimeException ex) {
                log.warn("Anomaly detection: tenant={} kpi={} failed, continuing with other KPIs: {}",
                        tenantId, series.kpiName(), ex.getMessage());
                issues.add(new DataQualityIssue(series.kpiName(), STAGE, ex.getMessage()));
            }
        }
        anomalies.sort(RANKING);
        history.sort(RANKING);
        log.debug("Anomaly detection: tenant={} kpis={} anomalies={} traceable={}",
                tenantId, seriesByKpi.size(), anomalies.size(), history.size());
        return new AnomalyReport(anomalies, history, issues);
    }

    /**
     * Evaluates the trailing evaluation window of one series, each point against the
     * history before it.
     */
    public List<Anomaly> detectSeries(
            String tenantId,
            PreparedSeries series,
            CrossKpiSnapshot snapshot,
            double priorCv,
            double threshold,
            Instant asOf) {
        return detectSeries(tenantId, series, snapshot, priorCv, threshold, asOf, settings.evaluationWindow());
    }

    List<Anomaly> detectSeries(
            String tenantId,
            PreparedSeries series,
            CrossKpiSnapshot snapshot,
            double priorCv,
            double threshold,
            Instant asOf,
            int window) {
        List<Anomaly> found = new ArrayList<>();
        int start = evaluationStart(series, window);
        for (int index = start; index < series.length(); index++) {
            DetectionContext context = new DetectionContext(tenantId, series, index, snapshot, priorCv, asOf);
            Optional<Anomaly> anomaly = detector.detect(context, threshold);
            anomaly.ifPresent(found::add);
        }
        return found;
    }

    private static int evaluationStart(PreparedSeries series, int window) {
        return Math.max(1, series.length() - window);
    }

    public double thresholdFor(String tenantId, String kpiName, FounderProfile profile) {
        double profileThreshold = profile != null
                ? profile.detectionThreshold()
                : settings.defaultProfile().baseThreshold();
        double base = settings.baseThresholdFor(kpiName, profileThreshold);
        return Statistics.clamp(base + thresholdStore.offsetFor(tenantId, kpiName), 0.05d, 0.95d);
    }

    CrossKpiSnapshot buildSnapshot(Map<String, PreparedSeries> seriesByKpi) {
        if (seriesByKpi.size() < 2) {
            return CrossKpiSnapshot.empty();
        }
        Map<Instant, Map<String, Double>> byTime = new HashMap<>();
        int window = settings.robustWindow();
        for (PreparedSeries series : seriesByKpi.values()) {
            for (int i = settings.minHistory(); i < series.length(); i++) {
                double[] trailing = series.trailing(i, window);
                double mad = Statistics.medianAbsoluteDeviation(trailing);
                if (mad == 0d) {
                    continue;
                }
                double z = StatisticalDetector.MODIFIED_Z_CONSTANT * (series.valueAt(i) - Statistics.median(trailing)) / mad;
                byTime.computeIfAbsent(series.timestampAt(i), key -> new HashMap<>()).put(series.kpiName(), z);
            }
        }
        return new CrossKpiSnapshot(byTime);
    }

    double populationPriorCv(Map<String, PreparedSeries> seriesByKpi) {
        double[] cvs = seriesByKpi.values().stream()
                .filter(series -> series.length() >= settings.minHistory())
                .mapToDouble(series -> Statistics.coefficientOfVariation(series.values()))
                .filter(cv -> cv > 0d && Double.isFinite(cv))
                .toArray();
        return cvs.length < 2 ? settings.populationPriorCv() : Statistics.median(cvs);
    }
}
