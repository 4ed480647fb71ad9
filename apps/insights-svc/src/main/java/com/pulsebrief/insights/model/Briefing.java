package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.List;

public record Briefing(
        String id,
        String tenantId,
        BriefingType type,
        Instant generatedAt,
        List<Section> sections,
        double estimatedReadMinutes,
        String dataQualityNote
) {

    public Briefing {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public int itemCount() {
        return sections.stream().mapToInt(section -> section.items().size()).sum();
    }

    public List<ContentItem> items() {
        return sections.stream().flatMap(section -> section.items().stream()).toList();
    }

    public record Section(BriefingSection section, String title, List<ContentItem> items) {
        public Section {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }
}
