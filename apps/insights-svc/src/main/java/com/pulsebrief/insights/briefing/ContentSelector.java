package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.BriefingSection;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.ContentType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Picks the items of a briefing from scored candidates.
 * <ol>
 *     <li>The best candidate of every mandatory section that has candidates.</li>
 *     <li>The best candidate of further sections until the diversity minimum is met.</li>
 *     <li>Remaining slots by score.</li>
 *     <li>Lowest scoring items are dropped until the read time fits the target, without
 *     emptying a mandatory section.</li>
 * </ol>
 * Per-type caps and the total cap hold at every step.
 */
@Component
public class ContentSelector {

    /** Highest score first; type order and id break ties. */
    public static final Comparator<ContentItem> BY_SCORE = Comparator
            .comparingDouble(ContentItem::score).reversed()
            .thenComparing(ContentItem::type)
            .thenComparing(ContentItem::id);

    private static final Map<BriefingType, Set<BriefingSection>> MANDATORY = Map.of(
            BriefingType.MORNING, EnumSet.of(BriefingSection.SCHEDULE, BriefingSection.PRIORITIES),
            BriefingType.EVENING, EnumSet.of(BriefingSection.METRICS, BriefingSection.DECISIONS),
            BriefingType.WEEKLY, EnumSet.of(BriefingSection.METRICS, BriefingSection.RECOMMENDATIONS));

    private final InsightsProperties.Briefing settings;

    public ContentSelector(InsightsProperties properties) {
        this.settings = properties.briefing();
    }

    public static Set<BriefingSection> mandatorySections(BriefingType type) {
        return MANDATORY.get(type);
    }

    public Selection select(BriefingType type, List<ContentItem> scored) {
        List<ContentItem> ranked = new ArrayList<>(scored);
        ranked.sort(BY_SCORE);
        Picker picker = new Picker();

        for (BriefingSection section : mandatorySections(type)) {
            bestIn(ranked, section, picker).ifPresent(picker::add);
        }

        Set<BriefingSection> available = EnumSet.noneOf(BriefingSection.class);
        ranked.forEach(item -> available.add(item.section()));
        int diversityTarget = Math.min(settings.minDistinctSections(), available.size());
        for (ContentItem item : ranked) {
            if (picker.sections().size() >= diversityTarget) {
                break;
            }
            if (!picker.sections().contains(item.section()) && picker.accepts(item)) {
                picker.add(item);
            }
        }

        for (ContentItem item : ranked) {
            if (picker.accepts(item)) {
                picker.add(item);
            }
        }

        List<ContentItem> selected = new ArrayList<>(picker.items());
        selected.sort(BY_SCORE);
        double target = settings.targetReadMinutesFor(type);
        boolean trimmed = false;
        while (readMinutes(selected) > target) {
            ContentItem removable = lowestRemovable(selected, mandatorySections(type));
            if (removable == null) {
                break;
            }
            selected.remove(removable);
            trimmed = true;
        }
        return new Selection(selected, readMinutes(selected), readMinutes(selected) <= target, trimmed);
    }

    public double readMinutes(List<ContentItem> items) {
        int words = items.stream().mapToInt(ContentItem::wordCount).sum();
        return (double) words / settings.wordsPerMinute();
    }

    private ContentItem lowestRemovable(List<ContentItem> selected, Set<BriefingSection> mandatory) {
        for (int i = selected.size() - 1; i >= 0; i--) {
            ContentItem candidate = selected.get(i);
            if (!mandatory.contains(candidate.section())) {
                return candidate;
            }
            long inSection = selected.stream().filter(item -> item.section() == candidate.section()).count();
            if (inSection > 1) {
                return candidate;
            }
        }
        return null;
    }

    private Optional<ContentItem> bestIn(List<ContentItem> ranked, BriefingSection section, Picker picker) {
        return ranked.stream()
                .filter(item -> item.section() == section)
                .filter(picker::accepts)
                .findFirst();
    }

    /** Result of a selection; {@code withinTarget} is false when mandatory content alone exceeds it. */
    public record Selection(List<ContentItem> items, double readMinutes, boolean withinTarget, boolean trimmed) {

        public Selection {
            items = List.copyOf(items);
        }

        public Map<BriefingSection, List<ContentItem>> bySection() {
            Map<BriefingSection, List<ContentItem>> grouped = new EnumMap<>(BriefingSection.class);
            for (ContentItem item : items) {
                grouped.computeIfAbsent(item.section(), ignored -> new ArrayList<>()).add(item);
            }
            return grouped;
        }
    }

    private final class Picker {

        private final Set<ContentItem> items = new LinkedHashSet<>();
        private final Map<ContentType, Integer> perType = new EnumMap<>(ContentType.class);
        private final Set<BriefingSection> sections = EnumSet.noneOf(BriefingSection.class);

        boolean accepts(ContentItem item) {
            return !items.contains(item)
                    && items.size() < settings.maxItems()
                    && perType.getOrDefault(item.type(), 0) < settings.capFor(item.type());
        }

        void add(ContentItem item) {
            items.add(item);
            perType.merge(item.type(), 1, Integer::sum);
            sections.add(item.section());
        }

        Set<ContentItem> items() {
            return items;
        }

        Set<BriefingSection> sections() {
            return sections;
        }
    }
}
