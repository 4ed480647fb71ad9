package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.stats.Statistics;
import java.util.Comparator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * priority = 100 * (wu*urgency + wi*impact + wf*feasibility + wc*confidence) with every
 * input clamped to [0,1] and non-negative weights summing to 1, so the score is within
 * [0,100] and non-decreasing in each input.
 */
@Component
public class PriorityScorer {

    /** Higher score first, then higher confidence, then category, then id. */
    public static final Comparator<Recommendation> RANKING = Comparator
            .comparingDouble(Recommendation::priorityScore).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::confidence).reversed())
            .thenComparing(Recommendation::category)
            .thenComparing(Recommendation::id);

    private final double urgencyWeight;
    private final double impactWeight;
    private final double feasibilityWeight;
    private final double confidenceWeight;

    @Autowired

    public PriorityScorer(InsightsProperties properties) {
        this(properties.recommendation().urgencyWeight(),
                properties.recommendation().impactWeight(),
                properties.recommendation().feasibilityWeight(),
                properties.recommendation().confidenceWeight());
    }

    PriorityScorer(double urgencyWeight, double impactWeight, double feasibilityWeight, double confidenceWeight) {
        this.urgencyWeight = urgencyWeight;
        this.impactWeight = impactWeight;
        this.feasibilityWeight = feasibilityWeight;
        this.confidenceWeight = confidenceWeight;
    }

    public double score(double urgency, double impact, double feasibility, double confidence) {
        double weighted = urgencyWeight * unit(urgency)
                + impactWeight * unit(impact)
                + feasibilityWeight * unit(feasibility)
                + confidenceWeight * unit(confidence);
        return Statistics.clamp(100d * weighted, 0d, 100d);
    }

    /** Level for candidates that carry none of their own. */
    public PriorityLevel levelFor(double score) {
        if (score >= 75d) {
            return PriorityLevel.HIGH;
        }
        if (score >= 55d) {
            return PriorityLevel.MEDIUM;
        }
        return PriorityLevel.LOW;
    }

    private static double unit(double value) {
        return Statistics.clamp(value, 0d, 1d);
    }
}
