package com.pulsebrief.insights.model;

/**
 * Scored briefing candidate. Sub-scores are in [0,1]; {@code score} is the final
 * weighted value in [0,100] after briefing-type and personalization multipliers.
 */
public record ContentItem(
        String id,
        ContentType type,
        String title,
        String body,
        int wordCount,
        double urgency,
        double impact,
        double relevance,
        double freshness,
        double actionability,
        double score,
        String sourceMethod,
        String sourceRef
) {

    public static final double MAX_SCORE = 100d;

    public ContentItem {
        if (score < 0d || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be within [0,100]: " + score);
        }
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount must be non-negative");
        }
    }

    public BriefingSection section() {
        return type.section();
    }

    public ContentItem withScore(double newScore) {
        return new ContentItem(id, type, title, body, wordCount, urgency, impact, relevance, freshness,
                actionability, newScore, sourceMethod, sourceRef);
    }
}
