package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.model.MessageItem;
import com.pulsebrief.insights.model.TaskItem;
import com.pulsebrief.insights.stats.Statistics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Derives {@link RecommendationSignals} from the task and message feeds. Sentiment is a
 * small lexicon score per message, averaged over messages that contain any scored word.
 */
@Component
public class SignalExtractor {

    private static final Set<String> NEGATIVE = Set.of(
            "angry", "frustrated", "disappointed", "cancel", "churn", "quit", "leaving", "unhappy",
            "broken", "blocked", "burnout", "complaint", "refund", "late", "worried", "concerned");
    private static final Set<String> POSITIVE = Set.of(
            "great", "love", "thanks", "happy", "excited", "impressed", "renew", "expand",
            "shipped", "win", "closed", "congrats", "excellent", "smooth");

    public RecommendationSignals extract(List<TaskItem> tasks, List<MessageItem> messages, Instant asOf) {
        int overdue = (int) tasks.stream()
                .filter(task -> !task.completed() && task.dueAt() != null && task.dueAt().isBefore(asOf))
                .count();
        return new RecommendationSignals(overdue, sentiment(messages));
    }

    double sentiment(List<MessageItem> messages) {
        List<Double> scores = new ArrayList<>();
        for (MessageItem message : messages) {
            String text = ((message.subject() == null ? "" : message.subject()) + " "
                    + (message.body() == null ? "" : message.body())).toLowerCase(Locale.ROOT);
            int positive = 0;
            int negative = 0;
            for (String token : text.split("[^a-z]+")) {
                if (POSITIVE.contains(token)) {
                    positive++;
                } else if (NEGATIVE.contains(token)) {
                    negative++;
                }
            }
            if (positive + negative > 0) {
                scores.add((double) (positive - negative) / (positive + negative));
            }
        }
        if (scores.isEmpty()) {
            return 0d;
        }
        double total = 0d;
        for (double score : scores) {
            total += score;
        }
        return Statistics.clamp(total / scores.size(), -1d, 1d);
    }
}
