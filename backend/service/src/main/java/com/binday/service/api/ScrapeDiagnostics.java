package com.binday.service.api;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters, a scrape-duration histogram and last-run state for the scrape cycle, exposed at {@code /metrics}.
 * Histogram buckets are upper bounds in seconds and are reported cumulatively, ending with {@code +Inf}.
 */
public final class ScrapeDiagnostics {
    static final List<String> DURATION_BUCKETS = List.of(
            "0.005", "0.01", "0.025", "0.05", "0.1", "0.25", "0.5", "1", "2.5", "5", "10"
    );
    private static final double[] DURATION_BOUNDS = DURATION_BUCKETS.stream().mapToDouble(Double::parseDouble).toArray();

    private final Clock clock;
    private final Instant startedAt;
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder scrapesTotal = new LongAdder();
    private final LongAdder scrapeFailuresTotal = new LongAdder();
    // one slot per bound plus +Inf; not cumulative until snapshot
    private final LongAdder[] durationBuckets = newAdders(DURATION_BUCKETS.size() + 1);
    private final LongAdder durationSumMillis = new LongAdder();
    private final Object lastRunLock = new Object();
    private LastRun lastRun = LastRun.empty();

    public ScrapeDiagnostics(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public static ScrapeDiagnostics empty() {
        return new ScrapeDiagnostics(Clock.systemUTC());
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordScrapeSuccess(Duration duration, int eventCount) {
        scrapesTotal.increment();
        observeDuration(duration);
        Instant now = clock.instant();
        synchronized (lastRunLock) {
            lastRun = new LastRun(now, duration.toMillis(), true, now, eventCount, null);
        }
    }

    public void recordScrapeFailure(Duration duration, Throwable error) {
        scrapesTotal.increment();
        scrapeFailuresTotal.increment();
        observeDuration(duration);
        Instant now = clock.instant();
        synchronized (lastRunLock) {
            lastRun = new LastRun(now, duration.toMillis(), false, lastRun.lastSuccessAt(), lastRun.lastEventCount(), describe(error));
        }
    }

    public Map<String, Object> snapshot() {
        LastRun run;
        synchronized (lastRunLock) {
            run = lastRun;
        }
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());
        metrics.put("cacheHits", cacheHits.longValue());
        metrics.put("cacheMisses", cacheMisses.longValue());
        metrics.put("scrapesTotal", scrapesTotal.longValue());
        metrics.put("scrapeFailuresTotal", scrapeFailuresTotal.longValue());
        metrics.put("scrapeDurationSeconds", durationHistogram());
        metrics.put("lastScrape", run.toMap());
        return metrics;
    }

    private void observeDuration(Duration duration) {
        double seconds = duration.toNanos() / 1_000_000_000.0;
        int slot = DURATION_BOUNDS.length;
        for (int i = 0; i < DURATION_BOUNDS.length; i++) {
            if (seconds <= DURATION_BOUNDS[i]) {
                slot = i;
                break;
            }
        }
        durationBuckets[slot].increment();
        durationSumMillis.add(duration.toMillis());
    }

    private Map<String, Object> durationHistogram() {
        List<Map<String, Object>> buckets = new ArrayList<>();
        long cumulative = 0;
        for (int i = 0; i < durationBuckets.length; i++) {
            cumulative += durationBuckets[i].longValue();
            Map<String, Object> bucket = new HashMap<>();
            bucket.put("le", i < DURATION_BUCKETS.size() ? DURATION_BUCKETS.get(i) : "+Inf");
            bucket.put("count", cumulative);
            buckets.add(bucket);
        }
        Map<String, Object> histogram = new HashMap<>();
        histogram.put("buckets", buckets);
        histogram.put("count", cumulative);
        histogram.put("sum", durationSumMillis.longValue() / 1000.0);
        return histogram;
    }

    private static LongAdder[] newAdders(int size) {
        LongAdder[] adders = new LongAdder[size];
        for (int i = 0; i < size; i++) {
            adders[i] = new LongAdder();
        }
        return adders;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private record LastRun(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            Instant lastSuccessAt,
            Integer lastEventCount,
            String lastErrorMessage
    ) {
        private static LastRun empty() {
            return new LastRun(null, null, null, null, null, null);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastSuccessAt", lastSuccessAt == null ? null : lastSuccessAt.toString());
            map.put("lastEventCount", lastEventCount);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
