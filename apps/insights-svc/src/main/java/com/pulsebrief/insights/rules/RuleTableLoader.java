package com.pulsebrief.insights.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsebrief.insights.error.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads the rule table JSON. Entries are bound one by one so a malformed rule or pattern
 * is skipped with a warning while the rest of the table loads.
 */
@Component
public class RuleTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleTableLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    public RuleTableLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, Clock clock) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    public RuleTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException(location, "rule table not found");
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in), location);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read rule table " + location, ex);
        }
    }

    RuleTable parse(JsonNode root, String source) {
        String version = root.path("version").asText("");
        if (version.isBlank()) {
            throw new ConfigurationException(source, "rule table has no version");
        }
        List<RuleDefinition> rules = new ArrayList<>();
        for (JsonNode node : root.path("rules")) {
            try {
                rules.add(objectMapper.treeToValue(node, RuleDefinition.class).validate());
            } catch (ConfigurationException ex) {
                log.warn("Rule table {}: skipping rule '{}': {}", version, ex.subject(), ex.getMessage());
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.warn("Rule table {}: skipping malformed rule '{}': {}", version, node.path("id").asText("?"), ex.getMessage());
            }
        }
        List<PatternDefinition> patterns = new ArrayList<>();
        for (JsonNode node : root.path("patterns")) {
            try {
                patterns.add(objectMapper.treeToValue(node, PatternDefinition.class).validate());
            } catch (ConfigurationException ex) {
                log.warn("Rule table {}: skipping pattern '{}': {}", version, ex.subject(), ex.getMessage());
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.warn("Rule table {}: skipping malformed pattern '{}': {}", version, node.path("name").asText("?"), ex.getMessage());
            }
        }
        log.info("Rule table {} loaded from {}: {} rules, {} patterns", version, source, rules.size(), patterns.size());
        return new RuleTable(version, clock.instant(), rules, patterns);
    }
}
