package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Briefing;
import com.pulsebrief.insights.model.BriefingSection;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.FeedbackAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assembles, stores and tracks briefings. Assembly never fails for lack of content: an
 * empty candidate pool yields a briefing with no sections and a note saying why.
 */
@Service
public class BriefingService {

    private static final Logger log = LoggerFactory.getLogger(BriefingService.class);
    private static final int MAX_NOTED_SUBJECTS = 5;

    private final ContentCandidateFactory candidateFactory;
    private final ContentScorer scorer;
    private final ContentSelector selector;
    private final EngagementStore engagement;
    private final BriefingRepository repository;
    private final Clock clock;

    public BriefingService(ContentCandidateFactory candidateFactory,
                           ContentScorer scorer,
                           ContentSelector selector,
                           EngagementStore engagement,
                           BriefingRepository repository,
                           Clock clock) {
        this.candidateFactory = candidateFactory;
        this.scorer = scorer;
        this.selector = selector;
        this.engagement = engagement;
        this.repository = repository;
        this.clock = clock;
    }

    public Briefing assemble(BriefingInputs inputs) {
        List<ContentItem> candidates = candidateFactory.candidates(inputs);
        List<ContentItem> scored = scorer.score(inputs.tenantId(), inputs.type(), candidates);
        ContentSelector.Selection selection = selector.select(inputs.type(), scored);

        List<Briefing.Section> sections = new ArrayList<>();
        for (Map.Entry<BriefingSection, List<ContentItem>> entry : selection.bySection().entrySet()) {
            sections.add(new Briefing.Section(entry.getKey(), entry.getKey().title(), entry.getValue()));
        }
        Briefing briefing = new Briefing(
                idFor(inputs),
                inputs.tenantId(),
                inputs.type(),
                inputs.asOf(),
                sections,
                selection.readMinutes(),
                dataQualityNote(inputs.issues(), candidates.isEmpty()));
        log.debug("Briefing assembly: tenant={} type={} candidates={} selected={} trimmed={} withinTarget={}",
                inputs.tenantId(), inputs.type(), candidates.size(), selection.items().size(), selection.trimmed(),
                selection.withinTarget());
        return repository.save(briefing);
    }

    /**
     * Stores an empty briefing whose note names every issue of the run. Used when
     * assembly itself failed, so the tenant still receives the data-quality report.
     */
    public Briefing degraded(BriefingInputs inputs, List<DataQualityIssue> issues) {
        Briefing briefing = new Briefing(
                idFor(inputs),
                inputs.tenantId(),
                inputs.type(),
                inputs.asOf(),
                List.of(),
                0d,
                dataQualityNote(issues, true));
        log.warn("Briefing assembly: tenant={} type={} degraded to an empty briefing", inputs.tenantId(), inputs.type());
        return repository.save(briefing);
    }

    public Briefing latest(String tenantId) {
        return repository.findLatest(tenantId)
                .orElseThrow(() -> new NoSuchElementException("No briefing for tenant " + tenantId));
    }

    public Briefing get(String briefingId) {
        return repository.findById(briefingId)
                .orElseThrow(() -> new NoSuchElementException("Briefing not found: " + briefingId));
    }

    public void markRead(String briefingId) {
        get(briefingId);
        repository.markRead(briefingId, clock.instant());
    }

    public void recordEngagement(String briefingId, String itemId, FeedbackAction action) {
        Briefing briefing = get(briefingId);
        ContentItem item = briefing.items().stream()
                .filter(candidate -> candidate.id().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("Item " + itemId + " not in briefing " + briefingId));
        engagement.record(briefing.tenantId(), item.type(), action.isPositive());
        log.debug("Briefing engagement: tenant={} type={} action={}", briefing.tenantId(), item.type(), action);
    }

    static String dataQualityNote(List<DataQualityIssue> issues, boolean noContent) {
        if (issues.isEmpty() && !noContent) {
            return null;
        }
        StringBuilder note = new StringBuilder();
        if (noContent) {
            note.append("No content was available for this briefing.");
        }
        if (!issues.isEmpty()) {
            Set<String> subjects = new LinkedHashSet<>();
            issues.forEach(issue -> subjects.add(issue.subject()));
            List<String> shown = subjects.stream().limit(MAX_NOTED_SUBJECTS).toList();
            if (note.length() > 0) {
                note.append(' ');
            }
            note.append("Some data could not be fully analysed (").append(String.join(", ", shown));
            if (subjects.size() > shown.size()) {
                note.append(" and ").append(subjects.size() - shown.size()).append(" more");
            }
            note.append("); related findings carry reduced confidence.");
        }
        return note.toString();
    }

    static String idFor(BriefingInputs inputs) {
        String key = inputs.tenantId() + "|" + inputs.type() + "|" + inputs.asOf();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
