package com.pulsebrief.insights.error;

public class ExternalServiceException extends InsightsException {

    public ExternalServiceException(String provider, String message) {
        super(provider, message);
    }

    public ExternalServiceException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
