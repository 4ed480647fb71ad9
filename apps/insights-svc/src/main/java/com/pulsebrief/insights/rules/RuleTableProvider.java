package com.pulsebrief.insights.rules;

import com.pulsebrief.insights.config.InsightsProperties;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holds the active rule table. Reloading swaps the reference; runs already in flight keep
 * the snapshot they captured.
 */
@Component
public class RuleTableProvider {

    private final RuleTableLoader loader;
    private final String location;
    private final AtomicReference<RuleTable> current = new AtomicReference<>();

    public RuleTableProvider(RuleTableLoader loader, InsightsProperties properties) {
        this.loader = loader;
        this.location = properties.recommendation().ruleTableLocation();
        this.current.set(loader.load(location));
    }

    public RuleTable current() {
        return current.get();
    }

    public RuleTable reload() {
        RuleTable table = loader.load(location);
        current.set(table);
        return table;
    }
}
