package com.pulsebrief.insights.health;

import com.pulsebrief.insights.rules.RuleTableProvider;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight unauthenticated health endpoint, reporting the active rule table version.
 */
@RestController
public class HealthzController {

    private final RuleTableProvider ruleTables;

    public HealthzController(RuleTableProvider ruleTables) {
        this.ruleTables = ruleTables;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP", "ruleTable", ruleTables.current().version());
    }
}
