package com.pulsebrief.insights.rules;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, versioned snapshot of rule and pattern definitions. A run captures one
 * table at start and hands it to every stage.
 */
public record RuleTable(String version, Instant loadedAt, List<RuleDefinition> rules, List<PatternDefinition> patterns) {

    public RuleTable {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("rule table version must be provided");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static RuleTable empty() {
        return new RuleTable("empty", Instant.EPOCH, List.of(), List.of());
    }
}
