package com.pulsebrief.insights.trend;

import com.pulsebrief.insights.anomaly.PreparedSeries;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.Trend;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes every timeframe for every KPI from scratch each run.
 */
@Service
public class TrendService {

    private static final Logger log = LoggerFactory.getLogger(TrendService.class);

    private final TrendAnalyzer analyzer;

    public TrendService(TrendAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public TrendReport analyzeAll(Map<String, PreparedSeries> seriesByKpi) {
        List<Trend> trends = new ArrayList<>();
        List<DataQualityIssue> issues = new ArrayList<>();
        for (PreparedSeries series : new TreeMap<>(seriesByKpi).values()) {
            for (Timeframe timeframe : Timeframe.values()) {
                try {
                    trends.add(analyzer.analyze(series, timeframe));
                } catch (RuntimeException ex) {
                    log.warn("Trend analysis: kpi={} timeframe={} failed: {}", series.kpiName(), timeframe, ex.getMessage());
                    issues.add(new DataQualityIssue(series.kpiName(), "trend_analysis", ex.getMessage()));
                }
            }
        }
        return new TrendReport(trends, issues);
    }

    public record TrendReport(List<Trend> trends, List<DataQualityIssue> issues) {

        public TrendReport {
            trends = List.copyOf(trends);
            issues = List.copyOf(issues);
        }

        /** Trend for the KPI and timeframe, or null when it was not computed. */
        public Trend find(String kpiName, Timeframe timeframe) {
            return trends.stream()
                    .filter(trend -> trend.kpiName().equals(kpiName) && trend.timeframe() == timeframe)
                    .findFirst()
                    .orElse(null);
        }
    }
}
