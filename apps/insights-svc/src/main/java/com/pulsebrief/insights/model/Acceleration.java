package com.pulsebrief.insights.model;

public enum Acceleration {
    ACCELERATING,
    DECELERATING,
    STEADY
}
