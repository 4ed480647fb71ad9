package com.pulsebrief.insights.feed;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

abstract class InMemoryItemFeed<T> implements ItemFeed<T> {

    private final Map<String, Map<String, T>> storage = new ConcurrentHashMap<>();
    private final Function<T, String> idOf;

    InMemoryItemFeed(Function<T, String> idOf) {
        this.idOf = idOf;
    }

    @Override
    public List<T> itemsFor(String tenantId) {
        Map<String, T> items = storage.get(tenantId);
        if (items == null) {
            return List.of();
        }
        synchronized (items) {
            return List.copyOf(items.values());
        }
    }

    @Override
    public void upsert(String tenantId, List<T> items) {
        Map<String, T> tenantItems = storage.computeIfAbsent(tenantId, ignored -> new LinkedHashMap<>());
        synchronized (tenantItems) {
            for (T item : items) {
                String id = idOf.apply(item);
                if (id == null || id.isBlank()) {
                    throw new IllegalArgumentException("feed items need an id");
                }
                tenantItems.put(id, item);
            }
        }
    }
}
