package com.pulsebrief.insights.error;

/**
 * A malformed rule or pattern definition. Only the offending entry is skipped.
 */
public class ConfigurationException extends InsightsException {

    public ConfigurationException(String definitionId, String message) {
        super(definitionId, message);
    }
}
