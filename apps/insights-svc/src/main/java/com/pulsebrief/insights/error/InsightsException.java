package com.pulsebrief.insights.error;

/**
 * Base type for failures raised inside the analytical stages. Callers decide per stage
 * whether a failure degrades one KPI, one rule or the whole run.
 */
public class InsightsException extends RuntimeException {

    private final String subject;

    public InsightsException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public InsightsException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /** KPI name, rule id or provider name the failure belongs to. */
    public String subject() {
        return subject;
    }
}
