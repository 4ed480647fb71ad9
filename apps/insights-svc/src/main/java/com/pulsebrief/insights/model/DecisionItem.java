package com.pulsebrief.insights.model;

import java.time.Instant;

public record DecisionItem(String id, String title, String summary, Instant decidedAt, double impact) {
}
