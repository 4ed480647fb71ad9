package com.pulsebrief.insights.model;

import java.time.Instant;

public record MessageItem(
        String id,
        String sender,
        String senderRole,
        String subject,
        String body,
        Instant receivedAt,
        boolean unread
) {
}
