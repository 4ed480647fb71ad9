package com.pulsebrief.insights.model;

public enum ContentType {
    TASK(BriefingSection.PRIORITIES),
    ANOMALY(BriefingSection.METRICS),
    MEETING(BriefingSection.SCHEDULE),
    MESSAGE(BriefingSection.INBOX),
    INSIGHT(BriefingSection.METRICS),
    DECISION(BriefingSection.DECISIONS),
    KPI_SNAPSHOT(BriefingSection.METRICS),
    RECOMMENDATION(BriefingSection.RECOMMENDATIONS);

    private final BriefingSection section;

    ContentType(BriefingSection section) {
        this.section = section;
    }

    public BriefingSection section() {
        return section;
    }
}
