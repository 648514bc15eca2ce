package com.binday.service.runtime;

import com.binday.core.model.CollectionEvent;
import com.binday.core.model.WasteType;
import com.binday.scraper.api.ScheduleFetchException;
import com.binday.scraper.api.ScrapeCancelledException;
import com.binday.scraper.api.ScrapeException;
import com.binday.service.api.ScrapeDiagnostics;
import com.binday.service.cache.CollectionCache;
import com.binday.service.support.MutableClock;
import com.binday.service.support.ScriptedScheduleSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionServiceTest {
    private static final Duration TTL = Duration.ofHours(168);
    private static final Duration SCRAPE_TIMEOUT = Duration.ofSeconds(15);
    private static final List<CollectionEvent> FIRST = List.of(event("2025-12-01T06:00:00Z", WasteType.REFUSE));
    private static final List<CollectionEvent> SECOND = List.of(event("2025-12-02T06:00:00Z", WasteType.RECYCLING));

    private final MutableClock clock = new MutableClock(Instant.parse("2025-11-28T09:00:00Z"), ZoneOffset.UTC);
    private final ScriptedScheduleSource source = new ScriptedScheduleSource();
    private final CollectionCache cache = new CollectionCache(clock);
    private final ScrapeDiagnostics diagnostics = new ScrapeDiagnostics(clock);
    private final CollectionService service = new CollectionService(source, cache, TTL, SCRAPE_TIMEOUT, clock, diagnostics);
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        source.releaseScrapes();
        executor.shutdownNow();
    }

    @Test
    void servesCacheUntilTtlExpires() {
        source.thenReturn(FIRST).thenReturn(SECOND);

        assertEquals(FIRST, service.collections(false));
        clock.advance(TTL);
        assertEquals(FIRST, service.collections(false));
        assertEquals(1, source.calls());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(SECOND, service.collections(false));
        assertEquals(2, source.calls());
    }

    @Test
    void forceRefreshBypassesCacheAndRepublishes() {
        source.thenReturn(FIRST).thenReturn(SECOND);

        service.collections(false);
        assertEquals(SECOND, service.collections(true));
        assertEquals(SECOND, service.collections(false));
        assertEquals(2, source.calls());
        assertEquals(2, cache.generation());
    }

    @Test
    void failedScrapeIsNotCachedAndPropagatesOriginalError() {
        ScheduleFetchException outage = new ScheduleFetchException("fetch schedule: unexpected status 503", 503);
        source.thenThrow(outage).thenReturn(FIRST);

        assertSame(outage, assertThrows(ScheduleFetchException.class, () -> service.collections(false)));
        assertTrue(cache.get(TTL).isEmpty());

        assertEquals(FIRST, service.collections(false));
        assertEquals(2, source.calls());
    }

    @Test
    void failedRefreshKeepsServingPreviousEntry() {
        source.thenReturn(FIRST).thenThrow(new ScheduleFetchException("fetch schedule: timeout", 0));

        service.collections(false);
        assertThrows(ScheduleFetchException.class, () -> service.collections(true));

        assertEquals(FIRST, service.collections(false));
        assertEquals(1, cache.generation());
    }

    @Test
    void scrapeRunsWithConfiguredDeadline() {
        source.thenReturn(FIRST);

        service.collections(false);

        assertEquals(clock.instant().plus(SCRAPE_TIMEOUT), source.lastContext().deadline());
    }

    @Test
    void concurrentMissesShareSingleScrape() throws Exception {
        source.thenReturn(FIRST);
        source.holdScrapes();

        List<Future<List<CollectionEvent>>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(executor.submit(() -> service.collections(false)));
        }
        assertTrue(source.awaitStarted(5, TimeUnit.SECONDS));
        awaitCacheMisses(8);
        source.releaseScrapes();

        for (Future<List<CollectionEvent>> result : results) {
            assertEquals(FIRST, result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, source.calls());
        assertEquals(1L, diagnostics.snapshot().get("scrapesTotal"));
    }

    @Test
    void sharedScrapeFailureReachesEveryWaiter() throws Exception {
        ScheduleFetchException outage = new ScheduleFetchException("fetch schedule: unexpected status 502", 502);
        source.thenThrow(outage);
        source.holdScrapes();

        List<Future<List<CollectionEvent>>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(executor.submit(() -> service.collections(false)));
        }
        assertTrue(source.awaitStarted(5, TimeUnit.SECONDS));
        awaitCacheMisses(4);
        source.releaseScrapes();

        for (Future<List<CollectionEvent>> result : results) {
            ExecutionException failure = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertSame(outage, failure.getCause());
        }
        assertEquals(1, source.calls());
        assertTrue(cache.get(TTL).isEmpty());
        assertEquals(1L, diagnostics.snapshot().get("scrapeFailuresTotal"));
    }

    @Test
    void leaderErrorReleasesEveryWaiter() throws Exception {
        StackOverflowError overflow = new StackOverflowError("deeply nested markup");
        source.thenFail(overflow);
        source.holdScrapes();

        List<Future<List<CollectionEvent>>> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            results.add(executor.submit(() -> service.collections(false)));
        }
        assertTrue(source.awaitStarted(5, TimeUnit.SECONDS));
        awaitCacheMisses(3);
        source.releaseScrapes();

        for (Future<List<CollectionEvent>> result : results) {
            ExecutionException failure = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            Throwable cause = failure.getCause();
            if (cause instanceof ScrapeException wrapped) {
                assertSame(overflow, wrapped.getCause());
            } else {
                assertSame(overflow, cause);
            }
        }
        assertEquals(1, source.calls());
        assertTrue(cache.get(TTL).isEmpty());
        assertEquals(1L, diagnostics.snapshot().get("scrapeFailuresTotal"));
    }

    @Test
    void shutdownCancelsInFlightScrapeWithoutPublishing() throws Exception {
        source.thenReturn(FIRST);
        source.holdScrapes();

        Future<List<CollectionEvent>> pending = executor.submit(() -> service.collections(false));
        assertTrue(source.awaitStarted(5, TimeUnit.SECONDS));
        service.shutdown();
        assertTrue(source.lastContext().isCancelled());
        source.releaseScrapes();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertTrue(failure.getCause() instanceof ScrapeCancelledException);
        assertTrue(cache.get(TTL).isEmpty());
    }

    private void awaitCacheMisses(long expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while ((Long) diagnostics.snapshot().get("cacheMisses") < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("callers never joined the in-flight scrape");
            }
            Thread.sleep(5);
        }
    }

    private static CollectionEvent event(String instant, WasteType type) {
        return new CollectionEvent(ZonedDateTime.parse(instant), type, List.of(), "");
    }
}
