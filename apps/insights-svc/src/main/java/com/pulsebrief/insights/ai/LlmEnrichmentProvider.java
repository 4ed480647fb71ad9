package com.pulsebrief.insights.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsebrief.insights.error.ExternalServiceException;
import com.pulsebrief.insights.model.Recommendation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model for a JSON object {@code {"rationale": "...", "actionItems": [...]}}.
 * Fenced or chatty replies are salvaged by cutting to the outermost braces; anything else
 * is a failure and the caller keeps the unenriched candidate.
 */
public class LlmEnrichmentProvider implements EnrichmentProvider {

    private static final Logger log = LoggerFactory.getLogger(LlmEnrichmentProvider.class);
    private static final int MAX_OUTPUT_TOKENS = 500;
    private static final int MAX_EXTRA_ITEMS = 3;

    private final LlmClient client;
    private final ObjectMapper objectMapper;

    public LlmEnrichmentProvider(LlmClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public EnrichmentOutcome enrich(Recommendation candidate, EnrichmentContext context) {
        Optional<String> response;
        try {
            response = client.generateText(List.of(
                    new LlmClient.Message("system", "You advise startup founders. Reply with JSON only."),
                    new LlmClient.Message("user", buildPrompt(candidate, context))), MAX_OUTPUT_TOKENS);
        } catch (ExternalServiceException ex) {
            return EnrichmentOutcome.failure(ex.subject() + " unavailable: " + ex.getMessage());
        }
        if (response.isEmpty()) {
            return EnrichmentOutcome.failure("empty model response");
        }
        return parse(response.get());
    }

    EnrichmentOutcome parse(String raw) {
        String text = raw.trim();
        int firstBrace = text.indexOf('{');
        int lastBrace = text.lastIndexOf('}');
        if (firstBrace < 0 || lastBrace <= firstBrace) {
            log.warn("Enrichment: model response was not JSON, keeping candidate as is");
            return EnrichmentOutcome.failure("response was not JSON");
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(
                    text.substring(firstBrace, lastBrace + 1), new TypeReference<Map<String, Object>>() {});
            Object rationale = parsed.get("rationale");
            if (rationale == null || rationale.toString().isBlank()) {
                return EnrichmentOutcome.failure("response had no rationale");
            }
            return EnrichmentOutcome.success(rationale.toString().trim(), extractItems(parsed.get("actionItems")));
        } catch (JsonProcessingException ex) {
            log.warn("Enrichment: failed to parse model response: {}", ex.getOriginalMessage());
            return EnrichmentOutcome.failure("unparseable response");
        }
    }

    private List<String> extractItems(Object value) {
        List<String> items = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank() && items.size() < MAX_EXTRA_ITEMS) {
                    items.add(item.toString().trim());
                }
            }
        }
        return items;
    }

    private String buildPrompt(Recommendation candidate, EnrichmentContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Recommendation: ").append(candidate.title()).append('\n');
        prompt.append("Category: ").append(candidate.category()).append('\n');
        prompt.append("Details: ").append(candidate.description()).append('\n');
        if (!candidate.actionItems().isEmpty()) {
            prompt.append("Existing steps: ").append(String.join("; ", candidate.actionItems())).append('\n');
        }
        if (context.companyStage() != null) {
            prompt.append("Company stage: ").append(context.companyStage()).append('\n');
        }
        if (!context.focusAreas().isEmpty()) {
            prompt.append("Founder focus: ").append(String.join(", ", context.focusAreas())).append('\n');
        }
        for (String line : context.evidence()) {
            prompt.append("Evidence: ").append(line).append('\n');
        }
        prompt.append("Return {\"rationale\": string of at most 60 words, \"actionItems\": up to 3 new concrete steps}.");
        return prompt.toString();
    }
}
