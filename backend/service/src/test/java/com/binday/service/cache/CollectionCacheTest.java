package com.binday.service.cache;

import com.binday.core.model.CollectionEvent;
import com.binday.core.model.WasteType;
import com.binday.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionCacheTest {
    private static final Duration TTL = Duration.ofHours(168);
    private final MutableClock clock = new MutableClock(Instant.parse("2025-12-01T08:00:00Z"), ZoneOffset.UTC);
    private final CollectionCache cache = new CollectionCache(clock);

    @Test
    void emptyCacheMisses() {
        assertTrue(cache.get(TTL).isEmpty());
        assertEquals(0, cache.generation());
    }

    @Test
    void entryIsServedUntilTtlElapsesInclusive() {
        cache.put(List.of(event()));

        clock.advance(TTL);
        assertEquals(1, cache.get(TTL).orElseThrow().events().size());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(TTL).isEmpty());
    }

    @Test
    void nonPositiveTtlDisablesCaching() {
        cache.put(List.of(event()));

        assertTrue(cache.get(Duration.ZERO).isEmpty());
        assertTrue(cache.get(Duration.ofSeconds(-1)).isEmpty());
    }

    @Test
    void putReplacesEntryAndBumpsGeneration() {
        CacheEntry first = cache.put(List.of(event()));
        clock.advance(Duration.ofMinutes(5));
        CacheEntry second = cache.put(List.of());

        assertEquals(1, first.generation());
        assertEquals(2, second.generation());
        assertEquals(2, cache.generation());
        assertEquals(clock.instant(), cache.get(TTL).orElseThrow().fetchedAt());
        assertTrue(cache.get(TTL).orElseThrow().events().isEmpty());
    }

    @Test
    void storedSnapshotIsDetachedFromCallerList() {
        List<CollectionEvent> events = new ArrayList<>(List.of(event()));
        cache.put(events);
        events.clear();

        List<CollectionEvent> cached = cache.get(TTL).orElseThrow().events();
        assertEquals(1, cached.size());
        assertThrows(UnsupportedOperationException.class, cached::clear);
    }

    private static CollectionEvent event() {
        return new CollectionEvent(ZonedDateTime.parse("2025-12-02T06:00:00Z"), WasteType.RECYCLING, List.of(), "");
    }
}
