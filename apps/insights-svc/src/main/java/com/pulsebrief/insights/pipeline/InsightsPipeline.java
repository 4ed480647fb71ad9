package com.pulsebrief.insights.pipeline;

import com.pulsebrief.insights.ai.EnrichmentContext;
import com.pulsebrief.insights.anomaly.AnomalyDetectionService;
import com.pulsebrief.insights.anomaly.AnomalyReport;
import com.pulsebrief.insights.anomaly.PreparedSeries;
import com.pulsebrief.insights.anomaly.SeriesPreparer;
import com.pulsebrief.insights.briefing.BriefingInputs;
import com.pulsebrief.insights.briefing.BriefingService;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.correlation.CorrelationEngine;
import com.pulsebrief.insights.correlation.DependencyAnalysis;
import com.pulsebrief.insights.correlation.JointAnomalyDetector;
import com.pulsebrief.insights.correlation.KpiGraph;
import com.pulsebrief.insights.correlation.PatternMatcher;
import com.pulsebrief.insights.correlation.RootCauseTracer;
import com.pulsebrief.insights.error.InsightsException;
import com.pulsebrief.insights.feed.CalendarFeed;
import com.pulsebrief.insights.feed.DecisionFeed;
import com.pulsebrief.insights.feed.FounderProfileRepository;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.feed.MessageFeed;
import com.pulsebrief.insights.feed.TaskFeed;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.Briefing;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.JointAnomaly;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.MessageItem;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RootCauseFinding;
import com.pulsebrief.insights.model.SamplingFrequency;
import com.pulsebrief.insights.model.TaskItem;
import com.pulsebrief.insights.recommendation.RecommendationEngine;
import com.pulsebrief.insights.recommendation.RecommendationInput;
import com.pulsebrief.insights.recommendation.RecommendationService;
import com.pulsebrief.insights.recommendation.RecommendationSignals;
import com.pulsebrief.insights.recommendation.SignalExtractor;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.rules.RuleTableProvider;
import com.pulsebrief.insights.trend.TrendService;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * One tenant run: prepare series, detect anomalies, analyse trends, build the dependency
 * graph, trace root causes, match patterns, recommend, then assemble the briefing. Stages
 * run in this order on the calling thread. A failing stage is recorded as a data-quality
 * issue and replaced by its empty result, so a briefing is always produced.
 */
@Service
public class InsightsPipeline {

    private static final Logger log = LoggerFactory.getLogger(InsightsPipeline.class);
    private static final int EVIDENCE_LINES = 5;

    private final KpiFeed kpiFeed;
    private final TaskFeed taskFeed;
    private final CalendarFeed calendarFeed;
    private final MessageFeed messageFeed;
    private final DecisionFeed decisionFeed;
    private final FounderProfileRepository profiles;
    private final RuleTableProvider ruleTables;
    private final SeriesPreparer seriesPreparer;
    private final AnomalyDetectionService anomalyDetection;
    private final TrendService trendService;
    private final CorrelationEngine correlationEngine;
    private final RootCauseTracer rootCauseTracer;
    private final PatternMatcher patternMatcher;
    private final JointAnomalyDetector jointAnomalyDetector;
    private final SignalExtractor signalExtractor;
    private final RecommendationEngine recommendationEngine;
    private final RecommendationService recommendationService;
    private final BriefingService briefingService;
    private final InsightsRunRepository runRepository;
    private final RunAuditLogger auditLogger;
    private final int maxLag;

    public InsightsPipeline(KpiFeed kpiFeed,
                            TaskFeed taskFeed,
                            CalendarFeed calendarFeed,
                            MessageFeed messageFeed,
                            DecisionFeed decisionFeed,
                            FounderProfileRepository profiles,
                            RuleTableProvider ruleTables,
                            SeriesPreparer seriesPreparer,
                            AnomalyDetectionService anomalyDetection,
                            TrendService trendService,
                            CorrelationEngine correlationEngine,
                            RootCauseTracer rootCauseTracer,
                            PatternMatcher patternMatcher,
                            JointAnomalyDetector jointAnomalyDetector,
                            SignalExtractor signalExtractor,
                            RecommendationEngine recommendationEngine,
                            RecommendationService recommendationService,
                            BriefingService briefingService,
                            InsightsRunRepository runRepository,
                            RunAuditLogger auditLogger,
                            InsightsProperties properties) {
        this.kpiFeed = kpiFeed;
        this.taskFeed = taskFeed;
        this.calendarFeed = calendarFeed;
        this.messageFeed = messageFeed;
        this.decisionFeed = decisionFeed;
        this.profiles = profiles;
        this.ruleTables = ruleTables;
        this.seriesPreparer = seriesPreparer;
        this.anomalyDetection = anomalyDetection;
        this.trendService = trendService;
        this.correlationEngine = correlationEngine;
        this.rootCauseTracer = rootCauseTracer;
        this.patternMatcher = patternMatcher;
        this.jointAnomalyDetector = jointAnomalyDetector;
        this.signalExtractor = signalExtractor;
        this.recommendationEngine = recommendationEngine;
        this.recommendationService = recommendationService;
        this.briefingService = briefingService;
        this.runRepository = runRepository;
        this.auditLogger = auditLogger;
        this.maxLag = properties.correlation().maxLag();
    }

    public InsightsRunResult run(String tenantId, BriefingType type, Instant asOf) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must be provided");
        }
        long started = System.nanoTime();
        MDC.put("tenant", tenantId);
        try {
            RuleTable table = ruleTables.current();
            FounderProfile profile = profiles.findOrDefault(tenantId);
            List<DataQualityIssue> issues = new ArrayList<>();

            Map<String, PreparedSeries> prepared = prepare(tenantId, asOf, issues);

            AnomalyReport anomalyReport = stage("anomaly_detection", issues,
                    () -> anomalyDetection.detect(tenantId, prepared, profile, asOf),
                    AnomalyReport.empty());
            issues.addAll(anomalyReport.issues());

            TrendService.TrendReport trends = stage("trend_analysis", issues,
                    () -> trendService.analyzeAll(prepared),
                    new TrendService.TrendReport(List.of(), List.of()));
            issues.addAll(trends.issues());

            KpiGraph graph = stage("correlation", issues,
                    () -> correlationEngine.buildGraph(prepared),
                    KpiGraph.builder(maxLag).build());
            DependencyAnalysis dependencies = stage("centrality", issues,
                    () -> correlationEngine.analyze(graph), DependencyAnalysis.empty());
            List<RootCauseFinding> rootCauses = stage("root_cause", issues,
                    () -> rootCauseTracer.traceAll(graph, anomalyReport.anomalies(), anomalyReport.history(),
                            kpi -> stepOf(prepared, kpi)),
                    List.of());
            List<PatternMatch> patternMatches = stage("pattern_matching", issues,
                    () -> patternMatcher.match(table.patterns(), trends), List.of());
            JointAnomaly jointAnomaly = stage("joint_anomaly", issues,
                    () -> jointAnomalyDetector.detect(prepared).orElse(null), null);

            Map<String, Double> latestValues = latestValues(tenantId, prepared);
            List<TaskItem> tasks = taskFeed.itemsFor(tenantId);
            List<MessageItem> messages = messageFeed.itemsFor(tenantId);
            RecommendationSignals signals = signalExtractor.extract(tasks, messages, asOf);
            List<String> evidence = evidence(anomalyReport.anomalies(), rootCauses);

            RecommendationInput recommendationInput = new RecommendationInput(
                    tenantId, asOf, latestValues, trends, patternMatches, signals, evidence);
            EnrichmentContext enrichmentContext = new EnrichmentContext(
                    tenantId, profile.companyStage(), profile.focusAreas(), evidence);
            List<Recommendation> recommendations = stage("recommendation", issues, () -> {
                RecommendationEngine.RecommendationOutcome outcome =
                        recommendationEngine.recommend(table, recommendationInput, enrichmentContext);
                issues.addAll(outcome.issues());
                return recommendationService.storeRun(outcome.recommendations());
            }, List.of());

            BriefingInputs briefingInputs = new BriefingInputs(
                    tenantId,
                    type,
                    asOf,
                    profile,
                    tasks,
                    calendarFeed.itemsFor(tenantId),
                    messages,
                    decisionFeed.itemsFor(tenantId),
                    anomalyReport.anomalies(),
                    rootCauses,
                    trends.trends(),
                    recommendations,
                    latestValues,
                    issues);
            Briefing briefing = stage("briefing", issues, () -> briefingService.assemble(briefingInputs), null);
            if (briefing == null) {
                briefing = briefingService.degraded(briefingInputs, issues);
            }

            InsightsRunResult result = new InsightsRunResult(
                    runIdFor(tenantId, type, asOf),
                    tenantId,
                    type,
                    asOf,
                    table.version(),
                    prepared.size(),
                    anomalyReport.anomalies(),
                    trends.trends(),
                    dependencies,
                    rootCauses,
                    patternMatches,
                    jointAnomaly,
                    recommendations,
                    briefing,
                    issues,
                    Duration.ofNanos(System.nanoTime() - started).toMillis());
            runRepository.save(result);
            auditLogger.record(result);
            return result;
        } finally {
            MDC.remove("tenant");
        }
    }

    private Map<String, PreparedSeries> prepare(String tenantId, Instant asOf, List<DataQualityIssue> issues) {
        Map<String, PreparedSeries> prepared = new LinkedHashMap<>();
        for (KpiSeries series : new TreeMap<>(kpiFeed.seriesFor(tenantId)).values()) {
            try {
                PreparedSeries preparedSeries = seriesPreparer.prepare(series, asOf);
                if (preparedSeries.truncated()) {
                    issues.add(new DataQualityIssue(series.kpiName(), "series_preparation",
                            "long gap in history, using observations from " + preparedSeries.origin() + " on"));
                }
                prepared.put(series.kpiName(), preparedSeries);
            } catch (InsightsException ex) {
                log.warn("Series preparation: tenant={} kpi={} excluded: {}", tenantId, series.kpiName(), ex.getMessage());
                issues.add(new DataQualityIssue(ex.subject(), "series_preparation", ex.getMessage()));
            }
        }
        return prepared;
    }

    private <T> T stage(String name, List<DataQualityIssue> issues, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (RuntimeException ex) {
            log.warn("Insights pipeline: stage {} failed, continuing without it", name, ex);
            issues.add(new DataQualityIssue(name, name, String.valueOf(ex.getMessage())));
            return fallback;
        }
    }

    private Map<String, Double> latestValues(String tenantId, Map<String, PreparedSeries> prepared) {
        Map<String, Double> values = new TreeMap<>();
        prepared.forEach((kpi, series) -> values.put(kpi, series.lastValue()));
        values.putAll(kpiFeed.derivedMetrics(tenantId));
        return values;
    }

    private static Duration stepOf(Map<String, PreparedSeries> prepared, String kpi) {
        PreparedSeries series = prepared.get(kpi);
        return series != null ? series.frequency().step() : SamplingFrequency.DAILY.step();
    }

    private static List<String> evidence(List<Anomaly> anomalies, List<RootCauseFinding> rootCauses) {
        List<String> lines = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            if (lines.size() == EVIDENCE_LINES) {
                break;
            }
            lines.add(anomaly.explanation());
        }
        for (RootCauseFinding finding : rootCauses) {
            if (lines.size() == EVIDENCE_LINES) {
                break;
            }
            lines.add(finding.explanation());
        }
        return lines;
    }

    static String runIdFor(String tenantId, BriefingType type, Instant asOf) {
        String key = "run|" + tenantId + "|" + type + "|" + asOf;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
