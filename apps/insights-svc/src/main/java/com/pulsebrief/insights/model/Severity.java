package com.pulsebrief.insights.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
