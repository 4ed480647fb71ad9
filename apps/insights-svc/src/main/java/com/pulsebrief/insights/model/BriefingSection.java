package com.pulsebrief.insights.model;

/**
 * Sections in display order.
 */
public enum BriefingSection {
    PRIORITIES("Today's priorities"),
    SCHEDULE("Schedule"),
    METRICS("Metrics"),
    INBOX("Inbox"),
    DECISIONS("Decisions"),
    RECOMMENDATIONS("Recommendations");

    private final String title;

    BriefingSection(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
