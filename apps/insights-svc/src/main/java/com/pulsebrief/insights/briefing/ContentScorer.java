package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.ContentType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * score = 100 * weighted sub-scores * briefing-type multiplier * personalization factor,
 * capped at 100.
 */
@Component
public class ContentScorer {

    static final Set<ContentType> FORWARD_LOOKING = EnumSet.of(ContentType.TASK, ContentType.MEETING, ContentType.RECOMMENDATION);
    static final Set<ContentType> RETROSPECTIVE = EnumSet.of(
            ContentType.ANOMALY, ContentType.DECISION, ContentType.KPI_SNAPSHOT, ContentType.INSIGHT);

    private final InsightsProperties.Briefing settings;
    private final EngagementStore engagement;

    public ContentScorer(InsightsProperties properties, EngagementStore engagement) {
        this.settings = properties.briefing();
        this.engagement = engagement;
    }

    public List<ContentItem> score(String tenantId, BriefingType type, List<ContentItem> candidates) {
        List<ContentItem> scored = new ArrayList<>(candidates.size());
        for (ContentItem item : candidates) {
            double score = baseScore(item) * typeMultiplier(type, item.type()) * engagement.factorFor(tenantId, item.type());
            scored.add(item.withScore(Math.min(score, ContentItem.MAX_SCORE)));
        }
        return scored;
    }

    double baseScore(ContentItem item) {
        return 100d * (settings.urgencyWeight() * item.urgency()
                + settings.impactWeight() * item.impact()
                + settings.relevanceWeight() * item.relevance()
                + settings.freshnessWeight() * item.freshness()
                + settings.actionabilityWeight() * item.actionability());
    }

    double typeMultiplier(BriefingType briefingType, ContentType contentType) {
        return switch (briefingType) {
            case MORNING -> FORWARD_LOOKING.contains(contentType) ? settings.typeBoost() : 1d;
            case EVENING -> RETROSPECTIVE.contains(contentType) ? settings.typeBoost() : 1d;
            case WEEKLY -> 1d;
        };
    }
}
