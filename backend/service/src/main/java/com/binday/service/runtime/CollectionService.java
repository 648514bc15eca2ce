package com.binday.service.runtime;

import com.binday.core.model.CollectionEvent;
import com.binday.scraper.api.ScheduleSource;
import com.binday.scraper.api.ScrapeContext;
import com.binday.scraper.api.ScrapeException;
import com.binday.service.api.ScrapeDiagnostics;
import com.binday.service.cache.CacheEntry;
import com.binday.service.cache.CollectionCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves collections from the cache and scrapes on a miss. Concurrent misses share a single in-flight
 * scrape; only a successful scrape is published to the cache.
 */
public class CollectionService {
    private static final Logger LOGGER = Logger.getLogger(CollectionService.class.getName());

    private final ScheduleSource source;
    private final CollectionCache cache;
    private final Duration cacheTtl;
    private final Duration scrapeTimeout;
    private final Clock clock;
    private final ScrapeDiagnostics diagnostics;
    private final Object flightLock = new Object();
    private InFlight inFlight;

    public CollectionService(
            ScheduleSource source,
            CollectionCache cache,
            Duration cacheTtl,
            Duration scrapeTimeout,
            Clock clock,
            ScrapeDiagnostics diagnostics
    ) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl is required");
        this.scrapeTimeout = Objects.requireNonNull(scrapeTimeout, "scrapeTimeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.diagnostics = diagnostics == null ? ScrapeDiagnostics.empty() : diagnostics;
    }

    /**
     * @param forceRefresh skip the cache lookup; joins a scrape that is already running
     * @throws ScrapeException when the scrape this call waited on failed
     */
    public List<CollectionEvent> collections(boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<CacheEntry> cached = cache.get(cacheTtl);
            if (cached.isPresent()) {
                return hit(cached.get());
            }
        }

        InFlight flight;
        boolean leader = false;
        synchronized (flightLock) {
            if (!forceRefresh) {
                // another caller may have published while we waited for the lock
                Optional<CacheEntry> cached = cache.get(cacheTtl);
                if (cached.isPresent()) {
                    return hit(cached.get());
                }
            }
            diagnostics.recordCacheMiss();
            if (inFlight == null) {
                inFlight = new InFlight(
                        cache.generation(),
                        ScrapeContext.withTimeout(clock, scrapeTimeout),
                        new CompletableFuture<>()
                );
                leader = true;
            }
            flight = inFlight;
        }

        if (leader) {
            runScrape(flight);
        }
        return await(flight);
    }

    /**
     * Cancels the scrape in progress, if any. Waiters receive the cancellation failure.
     */
    public void shutdown() {
        synchronized (flightLock) {
            if (inFlight != null) {
                inFlight.context().cancel();
            }
        }
    }

    private List<CollectionEvent> hit(CacheEntry entry) {
        diagnostics.recordCacheHit();
        LOGGER.fine("Cache hit (generation " + entry.generation() + ", fetched " + entry.fetchedAt() + ")");
        return entry.events();
    }

    private void runScrape(InFlight flight) {
        Instant startedAt = clock.instant();
        LOGGER.info("Scrape started (cache generation " + flight.generation() + ")");
        try {
            List<CollectionEvent> events = source.fetchCollections(flight.context());
            flight.context().checkActive();
            CacheEntry entry = cache.put(events);
            Duration took = Duration.between(startedAt, clock.instant());
            diagnostics.recordScrapeSuccess(took, entry.events().size());
            LOGGER.info("Scrape completed: " + entry.events().size() + " events in " + took.toMillis()
                    + "ms (cache generation " + entry.generation() + ")");
            flight.result().complete(entry.events());
        } catch (RuntimeException e) {
            diagnostics.recordScrapeFailure(Duration.between(startedAt, clock.instant()), e);
            LOGGER.warning("Scrape failed: " + e.getMessage());
            flight.result().completeExceptionally(e);
        } catch (Error e) {
            diagnostics.recordScrapeFailure(Duration.between(startedAt, clock.instant()), e);
            LOGGER.log(Level.SEVERE, "Scrape aborted", e);
            flight.result().completeExceptionally(e);
            throw e;
        } finally {
            synchronized (flightLock) {
                if (inFlight == flight) {
                    inFlight = null;
                }
            }
        }
    }

    private static List<CollectionEvent> await(InFlight flight) {
        try {
            return flight.result().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ScrapeException("scrape failed", cause);
        }
    }

    private record InFlight(long generation, ScrapeContext context, CompletableFuture<List<CollectionEvent>> result) {
    }
}
