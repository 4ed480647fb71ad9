package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.List;

public record MeetingItem(String id, String title, String agenda, Instant startsAt, List<String> attendeeRoles) {

    public MeetingItem {
        attendeeRoles = attendeeRoles == null ? List.of() : List.copyOf(attendeeRoles);
    }
}
