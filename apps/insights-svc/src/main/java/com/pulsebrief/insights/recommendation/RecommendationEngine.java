package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.ai.EnrichmentContext;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.stats.Statistics;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rule candidates, then pattern candidates, then signal adjustment, scoring, diversity
 * ranking and enrichment of the top K.
 */
@Service
public class RecommendationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    static final double FEASIBILITY_PENALTY_PER_OVERDUE_TASK = 0.05d;
    static final double MAX_FEASIBILITY_PENALTY = 0.3d;
    static final double NEGATIVE_SENTIMENT_THRESHOLD = -0.3d;
    static final double SENTIMENT_URGENCY_BOOST = 0.1d;
    private static final Set<String> SENTIMENT_SENSITIVE_CATEGORIES = Set.of("team", "customer");

    private final RuleEvaluator ruleEvaluator;
    private final PatternCandidateGenerator patternCandidates;
    private final PriorityScorer scorer;
    private final RecommendationRanker ranker;
    private final RecommendationEnricher enricher;

    public RecommendationEngine(RuleEvaluator ruleEvaluator,
                                PatternCandidateGenerator patternCandidates,
                                PriorityScorer scorer,
                                RecommendationRanker ranker,
                                RecommendationEnricher enricher) {
        this.ruleEvaluator = ruleEvaluator;
        this.patternCandidates = patternCandidates;
        this.scorer = scorer;
        this.ranker = ranker;
        this.enricher = enricher;
    }

    public RecommendationOutcome recommend(RuleTable table, RecommendationInput input, EnrichmentContext enrichmentContext) {
        List<DataQualityIssue> issues = new ArrayList<>();
        List<RecommendationCandidate> candidates = new ArrayList<>(ruleEvaluator.evaluate(table, input, issues));
        try {
            candidates.addAll(patternCandidates.generate(table, input));
        } catch (RuntimeException ex) {
            log.warn("Recommendation: pattern candidates failed for tenant {}: {}", input.tenantId(), ex.getMessage());
            issues.add(new DataQualityIssue("patterns", "recommendation", ex.getMessage()));
        }

        List<Recommendation> scored = new ArrayList<>();
        for (RecommendationCandidate candidate : candidates) {
            try {
                scored.add(toRecommendation(adjust(candidate, input.signals()), input));
            } catch (IllegalArgumentException ex) {
                log.warn("Recommendation: dropping candidate {}: {}", candidate.sourceKey(), ex.getMessage());
                issues.add(new DataQualityIssue(candidate.sourceKey(), "recommendation", ex.getMessage()));
            }
        }

        List<Recommendation> ranked = ranker.rank(scored);
        RecommendationEnricher.EnrichmentResult enriched = enricher.enrich(ranked, enrichmentContext);
        log.debug("Recommendation: tenant={} table={} candidates={} ranked={} enrichFailures={}",
                input.tenantId(), table.version(), candidates.size(), ranked.size(), enriched.failed());
        return new RecommendationOutcome(enriched.recommendations(), issues, enriched.attempted(), enriched.failed());
    }

    RecommendationCandidate adjust(RecommendationCandidate candidate, RecommendationSignals signals) {
        double penalty = Math.min(MAX_FEASIBILITY_PENALTY, FEASIBILITY_PENALTY_PER_OVERDUE_TASK * signals.overdueTasks());
        double feasibility = Statistics.clamp(candidate.feasibility() - penalty, 0d, 1d);
        double urgency = candidate.urgency();
        if (signals.sentiment() < NEGATIVE_SENTIMENT_THRESHOLD
                && SENTIMENT_SENSITIVE_CATEGORIES.contains(candidate.category())) {
            urgency = Statistics.clamp(urgency + SENTIMENT_URGENCY_BOOST, 0d, 1d);
        }
        return candidate.withAdjustedInputs(urgency, feasibility);
    }

    Recommendation toRecommendation(RecommendationCandidate candidate, RecommendationInput input) {
        double score = scorer.score(candidate.urgency(), candidate.impact(), candidate.feasibility(), candidate.confidence());
        PriorityLevel level = candidate.level() != null ? candidate.level() : scorer.levelFor(score);
        return new Recommendation(
                idFor(input, candidate),
                input.tenantId(),
                candidate.category(),
                candidate.title(),
                candidate.description(),
                null,
                score,
                candidate.urgency(),
                candidate.impact(),
                candidate.feasibility(),
                candidate.confidence(),
                level,
                candidate.actionItems(),
                candidate.source(),
                candidate.sourceKey(),
                RecommendationStatus.PENDING,
                candidate.pinned(),
                input.asOf());
    }

    /** Stable for the same tenant, source and day, so reruns update instead of duplicating. */
    static String idFor(RecommendationInput input, RecommendationCandidate candidate) {
        LocalDate day = LocalDate.ofInstant(input.asOf(), ZoneOffset.UTC);
        String key = input.tenantId() + "|" + candidate.source() + "|" + candidate.sourceKey() + "|" + day;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public record RecommendationOutcome(
            List<Recommendation> recommendations,
            List<DataQualityIssue> issues,
            int enrichmentAttempted,
            int enrichmentFailed
    ) {
        public RecommendationOutcome {
            recommendations = List.copyOf(recommendations);
            issues = List.copyOf(issues);
        }
    }
}
