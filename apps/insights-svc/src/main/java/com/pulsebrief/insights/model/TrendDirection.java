package com.pulsebrief.insights.model;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT,
    VOLATILE
}
