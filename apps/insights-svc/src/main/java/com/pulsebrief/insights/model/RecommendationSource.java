package com.pulsebrief.insights.model;

public enum RecommendationSource {
    RULE,
    PATTERN,
    ENRICHED
}
