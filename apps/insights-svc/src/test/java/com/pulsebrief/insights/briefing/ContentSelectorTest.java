package com.pulsebrief.insights.briefing;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.BriefingSection;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.ContentType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ContentSelectorTest {

    private final InsightsProperties properties = InsightsProperties.defaults();
    private final ContentSelector selector = new ContentSelector(properties);

    static ContentItem item(String id, ContentType type, double score, int words) {
        return new ContentItem(id, type, id, "body", words, 0.5d, 0.5d, 0.5d, 0.5d, 0.5d, score, "test", id);
    }

    private static List<ContentItem> twentyHighScoringItems(int words) {
        List<ContentItem> items = new ArrayList<>();
        ContentType[] types = {ContentType.TASK, ContentType.MEETING, ContentType.ANOMALY, ContentType.MESSAGE};
        for (int i = 0; i < 20; i++) {
            ContentType type = types[i % types.length];
            items.add(item(type.name().toLowerCase(Locale.ROOT) + "-" + i, type, 99d - i, words));
        }
        return items;
    }

    @Test
    void twentyStrongCandidatesRespectTotalAndTypeCaps() {
        ContentSelector.Selection selection = selector.select(BriefingType.MORNING, twentyHighScoringItems(20));

        assertThat(selection.items()).hasSizeLessThanOrEqualTo(7);
        Map<ContentType, Long> perType = selection.items().stream()
                .collect(Collectors.groupingBy(ContentItem::type, Collectors.counting()));
        perType.forEach((type, count) -> assertThat(count).isLessThanOrEqualTo(properties.briefing().capFor(type)));
        assertThat(selection.bySection()).containsKeys(BriefingSection.SCHEDULE, BriefingSection.PRIORITIES);
        assertThat(selection.bySection()).hasSizeGreaterThanOrEqualTo(3);
        assertThat(selection.readMinutes()).isLessThanOrEqualTo(3d);
        assertThat(selection.withinTarget()).isTrue();
        assertThat(selection.trimmed()).isFalse();
    }

    @Test
    void trimsLowestItemsToFitReadTimeButKeepsMandatorySections() {
        ContentSelector.Selection selection = selector.select(BriefingType.MORNING, twentyHighScoringItems(200));

        assertThat(selection.trimmed()).isTrue();
        assertThat(selection.readMinutes()).isLessThanOrEqualTo(3d);
        assertThat(selection.items()).hasSize(3);
        assertThat(selection.bySection()).containsKeys(BriefingSection.SCHEDULE, BriefingSection.PRIORITIES);
    }

    @Test
    void mandatoryContentMayExceedTheTarget() {
        List<ContentItem> items = List.of(
                item("task", ContentType.TASK, 90d, 700),
                item("meeting", ContentType.MEETING, 85d, 700),
                item("message", ContentType.MESSAGE, 80d, 10));

        ContentSelector.Selection selection = selector.select(BriefingType.MORNING, items);

        assertThat(selection.items()).extracting(ContentItem::id).containsExactlyInAnyOrder("task", "meeting");
        assertThat(selection.withinTarget()).isFalse();
    }

    @Test
    void diversityPullsInAThirdSectionBeforeFillingByScore() {
        List<ContentItem> items = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            items.add(item("metric-" + i, ContentType.ANOMALY, 95d - i, 10));
            items.add(item("decision-" + i, ContentType.DECISION, 90d - i, 10));
        }
        items.add(item("inbox", ContentType.MESSAGE, 20d, 10));
        items.add(item("kpi", ContentType.KPI_SNAPSHOT, 60d, 10));

        ContentSelector.Selection selection = selector.select(BriefingType.EVENING, items);

        Map<String, ContentItem> byId = selection.items().stream()
                .collect(Collectors.toMap(ContentItem::id, Function.identity()));
        assertThat(byId).containsKey("inbox");
        assertThat(selection.items()).filteredOn(item -> item.type() == ContentType.ANOMALY).hasSize(2);
        assertThat(selection.items()).filteredOn(item -> item.type() == ContentType.DECISION).hasSize(2);
    }

    @Test
    void emptyPoolYieldsEmptySelection() {
        ContentSelector.Selection selection = selector.select(BriefingType.WEEKLY, List.of());

        assertThat(selection.items()).isEmpty();
        assertThat(selection.withinTarget()).isTrue();
    }
}
