package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Acceleration;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.AnomalyDirection;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.ContentType;
import com.pulsebrief.insights.model.DecisionItem;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.MeetingItem;
import com.pulsebrief.insights.model.MessageItem;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import com.pulsebrief.insights.model.RootCauseFinding;
import com.pulsebrief.insights.model.TaskItem;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.model.TrendDirection;
import com.pulsebrief.insights.stats.Statistics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts feed items and run output into unscored {@link ContentItem}s. Urgency is
 * computed per type; the other sub-scores use the same freshness decay and focus-area
 * relevance for every type.
 */
@Component
public class ContentCandidateFactory {

    static final Set<String> MEETING_KEYWORDS = Set.of("board", "investor", "fundraising", "customer", "hiring");
    static final Set<String> KEY_ATTENDEE_ROLES = Set.of("investor", "board", "customer", "executive");
    static final Set<String> MESSAGE_URGENCY_KEYWORDS = Set.of("urgent", "asap", "deadline", "immediately", "critical");
    static final Map<String, Double> SENDER_ROLE_URGENCY = Map.of(
            "board", 0.85d,
            "investor", 0.8d,
            "customer", 0.7d,
            "team", 0.5d);
    private static final double OTHER_SENDER_URGENCY = 0.3d;
    private static final double FOCUS_RELEVANCE = 1.0d;
    private static final double DEFAULT_RELEVANCE = 0.6d;
    private static final int MAX_INSIGHTS = 6;

    private final double freshnessDecayHours;

    @Autowired

    public ContentCandidateFactory(InsightsProperties properties) {
        this(properties.briefing().freshnessDecayHours());
    }

    ContentCandidateFactory(double freshnessDecayHours) {
        this.freshnessDecayHours = freshnessDecayHours;
    }

    public List<ContentItem> candidates(BriefingInputs inputs) {
        List<ContentItem> items = new ArrayList<>();
        Instant now = inputs.asOf();
        FounderProfile profile = inputs.profile();
        for (TaskItem task : inputs.tasks()) {
            if (!task.completed()) {
                items.add(task(task, now, profile));
            }
        }
        for (Anomaly anomaly : inputs.anomalies()) {
            items.add(anomaly(anomaly, inputs, profile));
        }
        for (MeetingItem meeting : inputs.meetings()) {
            if (meeting.startsAt() != null && !meeting.startsAt().isBefore(now.minus(Duration.ofHours(1)))) {
                items.add(meeting(meeting, now, profile));
            }
        }
        for (MessageItem message : inputs.messages()) {
            items.add(message(message, now, profile));
        }
        for (DecisionItem decision : inputs.decisions()) {
            items.add(decision(decision, now, profile));
        }
        insights(inputs.trends()).forEach(trend -> items.add(insight(trend, now, profile)));
        kpiSnapshot(inputs.latestValues(), now, profile).ifPresent(items::add);
        for (Recommendation recommendation : inputs.recommendations()) {
            if (recommendation.status() == RecommendationStatus.PENDING) {
                items.add(recommendation(recommendation, now, profile));
            }
        }
        return items;
    }

    ContentItem task(TaskItem task, Instant now, FounderProfile profile) {
        double urgency = taskUrgency(task, now);
        double impact = switch (task.priority() == null ? TaskItem.Priority.MEDIUM : task.priority()) {
            case HIGH -> 0.8d;
            case MEDIUM -> 0.5d;
            case LOW -> 0.3d;
        } + (task.blocking() ? 0.1d : 0d);
        String body = task.description() == null ? "" : task.description();
        if (task.dueAt() != null) {
            body = (body.isBlank() ? "" : body + " ") + "Due " + task.dueAt() + ".";
        }
        return item("task:" + task.id(), ContentType.TASK, task.title(), body, urgency, impact,
                relevance(profile, task.title(), task.description()), 1d, 0.9d, "task_feed", task.id());
    }

    static double taskUrgency(TaskItem task, Instant now) {
        double base;
        if (task.dueAt() == null) {
            base = 0.1d;
        } else {
            long minutes = Duration.between(now, task.dueAt()).toMinutes();
            if (minutes < 0) {
                base = 1.0d;
            } else if (minutes <= 4 * 60) {
                base = 0.9d;
            } else if (minutes <= 24 * 60) {
                base = 0.75d;
            } else if (minutes <= 72 * 60) {
                base = 0.5d;
            } else if (minutes <= 7 * 24 * 60) {
                base = 0.3d;
            } else {
                base = 0.1d;
            }
        }
        if (task.priority() == TaskItem.Priority.HIGH) {
            base += 0.1d;
        }
        if (task.blocking()) {
            base += 0.1d;
        }
        return Statistics.clamp(base, 0d, 1d);
    }

    ContentItem anomaly(Anomaly anomaly, BriefingInputs inputs, FounderProfile profile) {
        double urgency = switch (anomaly.severity()) {
            case CRITICAL -> 1.0d;
            case HIGH -> 0.8d;
            case MEDIUM -> 0.55d;
            case LOW -> 0.3d;
        };
        Trend weekly = find(inputs.trends(), anomaly.kpiName(), Timeframe.WOW);
        if (weekly != null && !weekly.indeterminate()) {
            if (weekly.acceleration() == Acceleration.ACCELERATING) {
                urgency += 0.1d;
            } else if (weekly.acceleration() == Acceleration.DECELERATING) {
                urgency -= 0.05d;
            }
        }
        String body = anomaly.explanation();
        for (RootCauseFinding finding : inputs.rootCauses()) {
            if (finding.kpiName().equals(anomaly.kpiName()) && finding.anomalyTimestamp().equals(anomaly.timestamp())) {
                body = body + " " + finding.explanation();
            }
        }
        double impact = 0.5d + 0.5d * Math.min(1d, Math.abs(anomaly.magnitude()));
        String title = anomaly.kpiName() + (anomaly.direction() == AnomalyDirection.DOWN ? " dropped " : " spiked ")
                + percent(anomaly.magnitude());
        return item("anomaly:" + anomaly.id(), ContentType.ANOMALY, title, body, Statistics.clamp(urgency, 0d, 1d),
                impact, relevance(profile, anomaly.kpiName(), anomaly.explanation()),
                freshness(anomaly.timestamp(), inputs.asOf()), 0.6d, "anomaly_detection", anomaly.id());
    }

    ContentItem meeting(MeetingItem meeting, Instant now, FounderProfile profile) {
        double urgency = meetingUrgency(meeting, now);
        boolean keyAttendee = meeting.attendeeRoles().stream()
                .anyMatch(role -> KEY_ATTENDEE_ROLES.contains(role.toLowerCase(Locale.ROOT)));
        double impact = keyAttendee ? 0.7d : 0.5d;
        String body = meeting.agenda() == null ? "" : meeting.agenda();
        body = (body.isBlank() ? "" : body + " ") + "Starts " + meeting.startsAt() + ".";
        return item("meeting:" + meeting.id(), ContentType.MEETING, meeting.title(), body, urgency, impact,
                relevance(profile, meeting.title(), meeting.agenda()), 1d, 0.5d, "calendar_feed", meeting.id());
    }

    static double meetingUrgency(MeetingItem meeting, Instant now) {
        long minutes = Duration.between(now, meeting.startsAt()).toMinutes();
        double base;
        if (minutes < 60) {
            base = 0.9d;
        } else if (minutes < 3 * 60) {
            base = 0.75d;
        } else if (minutes < 24 * 60) {
            base = 0.6d;
        } else if (minutes < 48 * 60) {
            base = 0.4d;
        } else {
            base = 0.2d;
        }
        String text = ((meeting.title() == null ? "" : meeting.title()) + " "
                + (meeting.agenda() == null ? "" : meeting.agenda())).toLowerCase(Locale.ROOT);
        long keywords = MEETING_KEYWORDS.stream().filter(text::contains).count();
        base += Math.min(0.2d, 0.1d * keywords);
        boolean keyAttendee = meeting.attendeeRoles().stream()
                .anyMatch(role -> KEY_ATTENDEE_ROLES.contains(role.toLowerCase(Locale.ROOT)));
        if (keyAttendee) {
            base += 0.1d;
        }
        return Statistics.clamp(base, 0d, 1d);
    }

    ContentItem message(MessageItem message, Instant now, FounderProfile profile) {
        double urgency = messageUrgency(message);
        String role = message.senderRole() == null ? "" : message.senderRole().toLowerCase(Locale.ROOT);
        double impact = "board".equals(role) || "investor".equals(role) ? 0.6d : 0.4d;
        String title = message.subject() == null || message.subject().isBlank()
                ? "Message from " + message.sender()
                : message.subject();
        return item("message:" + message.id(), ContentType.MESSAGE, title, message.body(), urgency, impact,
                relevance(profile, message.subject(), message.body()), freshness(message.receivedAt(), now),
                message.unread() ? 0.6d : 0.3d, "message_feed", message.id());
    }

    static double messageUrgency(MessageItem message) {
        String role = message.senderRole() == null ? "" : message.senderRole().toLowerCase(Locale.ROOT);
        double base = SENDER_ROLE_URGENCY.getOrDefault(role, OTHER_SENDER_URGENCY);
        String text = ((message.subject() == null ? "" : message.subject()) + " "
                + (message.body() == null ? "" : message.body())).toLowerCase(Locale.ROOT);
        if (MESSAGE_URGENCY_KEYWORDS.stream().anyMatch(text::contains)) {
            base += 0.15d;
        }
        if (message.unread()) {
            base += 0.05d;
        }
        return Statistics.clamp(base, 0d, 1d);
    }

    ContentItem decision(DecisionItem decision, Instant now, FounderProfile profile) {
        return item("decision:" + decision.id(), ContentType.DECISION, decision.title(), decision.summary(), 0.4d,
                Statistics.clamp(decision.impact(), 0d, 1d), relevance(profile, decision.title(), decision.summary()),
                freshness(decision.decidedAt(), now), 0.4d, "decision_feed", decision.id());
    }

    /** Significant, directional trends, strongest first, one per KPI. */
    List<Trend> insights(List<Trend> trends) {
        Map<String, Trend> strongest = new TreeMap<>();
        for (Trend trend : trends) {
            if (trend.indeterminate() || !trend.significant()
                    || trend.direction() == TrendDirection.FLAT || trend.direction() == TrendDirection.VOLATILE) {
                continue;
            }
            strongest.merge(trend.kpiName(), trend,
                    (left, right) -> Math.abs(right.magnitude()) > Math.abs(left.magnitude()) ? right : left);
        }
        return strongest.values().stream()
                .sorted(Comparator.comparingDouble((Trend trend) -> Math.abs(trend.magnitude())).reversed()
                        .thenComparing(Trend::kpiName))
                .limit(MAX_INSIGHTS)
                .toList();
    }

    ContentItem insight(Trend trend, Instant now, FounderProfile profile) {
        double impact = switch (trend.effectSize()) {
            case LARGE -> 0.8d;
            case MEDIUM -> 0.6d;
            case SMALL -> 0.4d;
            case NEGLIGIBLE -> 0.2d;
        };
        double urgency = trend.acceleration() == Acceleration.ACCELERATING ? 0.5d : 0.35d;
        String title = trend.kpiName() + " " + trend.direction().name().toLowerCase(Locale.ROOT) + " "
                + percent(trend.magnitude()) + " " + trend.timeframe();
        String body = String.format(Locale.ROOT, "%s moved from %.2f to %.2f (p=%.3f, %s effect, %s).",
                trend.kpiName(), trend.priorMean(), trend.currentMean(), trend.pValue(),
                trend.effectSize().name().toLowerCase(Locale.ROOT), trend.acceleration().name().toLowerCase(Locale.ROOT));
        return item("insight:" + trend.kpiName() + ":" + trend.timeframe(), ContentType.INSIGHT, title, body, urgency,
                impact, relevance(profile, trend.kpiName(), null), 1d, 0.3d, trend.method(),
                trend.kpiName() + ":" + trend.timeframe());
    }

    Optional<ContentItem> kpiSnapshot(Map<String, Double> latestValues, Instant now, FounderProfile profile) {
        if (latestValues.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder body = new StringBuilder();
        new TreeMap<>(latestValues).forEach((kpi, value) -> {
            if (body.length() > 0) {
                body.append(", ");
            }
            body.append(kpi).append(' ').append(String.format(Locale.ROOT, "%.2f", value));
        });
        return Optional.of(item("snapshot:" + now, ContentType.KPI_SNAPSHOT, "KPI snapshot", body.toString(), 0.2d, 0.5d,
                relevance(profile, body.toString(), null), 1d, 0.2d, "kpi_feed", "latest"));
    }

    ContentItem recommendation(Recommendation recommendation, Instant now, FounderProfile profile) {
        String body = recommendation.description();
        if (recommendation.rationale() != null && !recommendation.rationale().isBlank()) {
            body = body + " " + recommendation.rationale();
        }
        if (!recommendation.actionItems().isEmpty()) {
            body = body + " Next: " + String.join("; ", recommendation.actionItems()) + ".";
        }
        return item("recommendation:" + recommendation.id(), ContentType.RECOMMENDATION, recommendation.title(), body,
                recommendation.urgency(), recommendation.priorityScore() / 100d,
                relevance(profile, recommendation.category(), recommendation.title()),
                freshness(recommendation.createdAt(), now), 0.8d,
                recommendation.source().name().toLowerCase(Locale.ROOT), recommendation.id());
    }

    double freshness(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return 1d;
        }
        double ageHours = Math.max(0d, Duration.between(timestamp, now).toMinutes() / 60d);
        return Math.exp(-ageHours / freshnessDecayHours);
    }

    static double relevance(FounderProfile profile, String primary, String secondary) {
        return profile.focusesOn(primary) || profile.focusesOn(secondary) ? FOCUS_RELEVANCE : DEFAULT_RELEVANCE;
    }

    static int wordCount(String... parts) {
        int count = 0;
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            count += part.trim().split("\\s+").length;
        }
        return count;
    }

    private static ContentItem item(String id, ContentType type, String title, String body, double urgency,
                                    double impact, double relevance, double freshness, double actionability,
                                    String sourceMethod, String sourceRef) {
        String safeTitle = title == null ? "" : title;
        String safeBody = body == null ? "" : body;
        return new ContentItem(id, type, safeTitle, safeBody, wordCount(safeTitle, safeBody),
                Statistics.clamp(urgency, 0d, 1d), Statistics.clamp(impact, 0d, 1d),
                Statistics.clamp(relevance, 0d, 1d), Statistics.clamp(freshness, 0d, 1d),
                Statistics.clamp(actionability, 0d, 1d), 0d, sourceMethod, sourceRef);
    }

    private static Trend find(List<Trend> trends, String kpi, Timeframe timeframe) {
        for (Trend trend : trends) {
            if (trend.kpiName().equals(kpi) && trend.timeframe() == timeframe) {
                return trend;
            }
        }
        return null;
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.0f%%", Math.abs(fraction) * 100d);
    }
}
