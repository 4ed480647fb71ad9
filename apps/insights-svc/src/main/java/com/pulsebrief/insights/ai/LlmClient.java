package com.pulsebrief.insights.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.error.ExternalServiceException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Text generation over an OpenAI Responses style endpoint or the Gemini generateContent
 * endpoint, selected by {@code insights.ai.provider}. Missing credentials or a blank reply
 * yield an empty result; transport and HTTP failures raise {@link ExternalServiceException}.
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);
    private static final String GEMINI_DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";
    private static final int DEFAULT_MAX_TOKENS = 400;
    private static final int MAX_TOKENS = 2048;

    private enum Provider { OPENAI, GEMINI }

    public record Message(String role, String content) {}

    record ResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    private final InsightsProperties.Ai properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public LlmClient(InsightsProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, RestClient.builder().requestFactory(requestFactory(properties.ai().timeout())));
    }

    LlmClient(InsightsProperties properties, ObjectMapper objectMapper, RestClient.Builder builder) {
        this.properties = properties.ai();
        this.objectMapper = objectMapper;
        this.restClient = builder.build();
        log.info("LLM client configured: provider={} model={} timeoutMs={}",
                this.properties.providerOrDefault(), this.properties.model(), this.properties.timeout().toMillis());
    }

    public boolean hasCredentials() {
        return properties.hasApiKey();
    }

    public Optional<String> generateText(List<Message> messages, Integer maxOutputTokens) {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        int maxTokens = sanitize(maxOutputTokens);
        return switch (provider()) {
            case OPENAI -> generateOpenAi(messages, maxTokens);
            case GEMINI -> generateGemini(messages, maxTokens);
        };
    }

    private Optional<String> generateOpenAi(List<Message> messages, int maxTokens) {
        try {
            JsonNode response = restClient.post()
                    .uri(properties.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(properties.apiKey()))
                    .body(new ResponsesRequest(properties.model(), messages, maxTokens))
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response.get("output_text"));
            }
            return Optional.ofNullable(text).filter(value -> !value.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("LLM call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
            throw new ExternalServiceException("openai", "status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.warn("LLM call failed: {}", ex.getMessage());
            throw new ExternalServiceException("openai", String.valueOf(ex.getMessage()), ex);
        }
    }

    private Optional<String> generateGemini(List<Message> messages, int maxTokens) {
        ObjectNode payload = objectMapper.createObjectNode();
        StringBuilder system = new StringBuilder();
        ArrayNode contents = payload.putArray("contents");
        for (Message message : messages) {
            if (message == null || message.content() == null) {
                continue;
            }
            if ("system".equalsIgnoreCase(message.role())) {
                system.append(system.length() > 0 ? "\n\n" : "").append(message.content());
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", "assistant".equalsIgnoreCase(message.role()) ? "model" : "user");
            content.putArray("parts").addObject().put("text", message.content());
        }
        if (system.length() > 0) {
            payload.putObject("systemInstruction").putArray("parts").addObject().put("text", system.toString());
        }
        payload.putObject("generationConfig").put("maxOutputTokens", maxTokens);
        try {
            JsonNode response = restClient.post()
                    .uri(geminiEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.set("x-goog-api-key", properties.apiKey()))
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("candidates"));
            return Optional.ofNullable(text).filter(value -> !value.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("Gemini call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
            throw new ExternalServiceException("gemini", "status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.warn("Gemini call failed: {}", ex.getMessage());
            throw new ExternalServiceException("gemini", String.valueOf(ex.getMessage()), ex);
        }
    }

    private String geminiEndpoint() {
        String base = properties.endpoint();
        if (base == null || base.isBlank() || base.contains("api.openai.com")) {
            base = GEMINI_DEFAULT_ENDPOINT;
        }
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return base + "models/" + properties.model() + ":generateContent";
    }

    private Provider provider() {
        return "gemini".equals(properties.providerOrDefault()) ? Provider.GEMINI : Provider.OPENAI;
    }

    private static int sanitize(Integer requested) {
        int value = requested != null && requested > 0 ? requested : DEFAULT_MAX_TOKENS;
        return Math.min(value, MAX_TOKENS);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    /** First non-blank text found by walking arrays and the usual content/text/parts keys. */
    static String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        for (String key : List.of("content", "parts", "text")) {
            String nested = extractText(node.get(key));
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        return null;
    }
}
