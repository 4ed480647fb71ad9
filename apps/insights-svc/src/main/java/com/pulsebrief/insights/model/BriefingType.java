package com.pulsebrief.insights.model;

public enum BriefingType {
    /** Start-of-period digest. */
    MORNING,
    /** End-of-period digest. */
    EVENING,
    WEEKLY
}
