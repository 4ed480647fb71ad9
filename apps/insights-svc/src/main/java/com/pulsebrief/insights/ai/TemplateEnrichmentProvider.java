package com.pulsebrief.insights.ai;

import com.pulsebrief.insights.model.Recommendation;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic enrichment used when no model credentials are configured. The rationale
 * is assembled from the candidate's scores and the run's evidence lines.
 */
public class TemplateEnrichmentProvider implements EnrichmentProvider {

    private static final int EVIDENCE_LINES = 2;

    @Override
    public String name() {
        return "template";
    }

    @Override
    public EnrichmentOutcome enrich(Recommendation candidate, EnrichmentContext context) {
        StringBuilder rationale = new StringBuilder();
        rationale.append(candidate.title()).append(" ranks ")
                .append(String.format(Locale.ROOT, "%.0f", candidate.priorityScore()))
                .append("/100 (urgency ")
                .append(String.format(Locale.ROOT, "%.2f", candidate.urgency()))
                .append(", impact ")
                .append(String.format(Locale.ROOT, "%.2f", candidate.impact()))
                .append(").");
        List<String> relevant = new ArrayList<>();
        for (String line : context.evidence()) {
            if (relevant.size() == EVIDENCE_LINES) {
                break;
            }
            if (mentionsCategory(line, candidate.category()) || relevant.isEmpty()) {
                relevant.add(line);
            }
        }
        for (String line : relevant) {
            rationale.append(' ').append(line);
        }
        if (context.companyStage() != null && !context.companyStage().isBlank()) {
            rationale.append(" Weighed for a ").append(context.companyStage()).append(" company.");
        }
        List<String> extra = candidate.actionItems().isEmpty()
                ? List.of("Review " + candidate.category() + " metrics with the team this week")
                : List.of();
        return EnrichmentOutcome.success(rationale.toString(), extra);
    }

    private static boolean mentionsCategory(String line, String category) {
        return line != null && category != null && line.toLowerCase(Locale.ROOT).contains(category.toLowerCase(Locale.ROOT));
    }
}
