package com.pulsebrief.insights.model;

public enum AnomalyDirection {
    UP,
    DOWN
}
