package com.binday.service.cache;

import com.binday.core.model.CollectionEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-slot cache of the last successful scrape. Readers share the read lock; a store swaps in a whole
 * new {@link CacheEntry}, so a reader sees either the previous entry or the next one.
 */
public class CollectionCache {
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private CacheEntry entry;
    private long generation;

    public CollectionCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the entry when present and no older than {@code ttl}. A non-positive ttl disables caching.
     */
    public Optional<CacheEntry> get(Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            if (entry == null) {
                return Optional.empty();
            }
            if (Duration.between(entry.fetchedAt(), clock.instant()).compareTo(ttl) > 0) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheEntry put(List<CollectionEvent> events) {
        lock.writeLock().lock();
        try {
            generation++;
            entry = new CacheEntry(events, clock.instant(), generation);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }
}
