package com.pulsebrief.insights.model;

public enum PriorityLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
