package com.pulsebrief.insights.feed;

import java.util.List;

/**
 * Tenant-scoped feed of operational items (tasks, meetings, messages, decisions).
 */
public interface ItemFeed<T> {

    List<T> itemsFor(String tenantId);

    /** Inserts or replaces items by id. */
    void upsert(String tenantId, List<T> items);
}
