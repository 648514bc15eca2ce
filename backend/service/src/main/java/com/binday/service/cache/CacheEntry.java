package com.binday.service.cache;

import com.binday.core.model.CollectionEvent;

import java.time.Instant;
import java.util.List;

/**
 * @param generation incremented on every successful store; lets callers tell refreshes apart
 */
public record CacheEntry(List<CollectionEvent> events, Instant fetchedAt, long generation) {
    public CacheEntry {
        events = List.copyOf(events);
    }
}
