package com.pulsebrief.insights.model;

import java.time.Instant;

public record TaskItem(
        String id,
        String title,
        String description,
        Instant dueAt,
        Priority priority,
        boolean blocking,
        boolean completed
) {

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
