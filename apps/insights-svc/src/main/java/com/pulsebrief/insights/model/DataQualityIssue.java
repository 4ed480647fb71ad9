package com.pulsebrief.insights.model;

public record DataQualityIssue(String subject, String stage, String message) {
}
