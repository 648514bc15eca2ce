package com.binday.scraper.api;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline and cancellation signal shared by every step of one scrape cycle.
 *
 * <p>Both the courtesy pause and the outbound HTTP calls wait through this context, so cancelling it (or
 * letting the deadline pass) aborts whichever step is currently in progress.
 */
public final class ScrapeContext {
    private final Clock clock;
    private final Instant deadline;
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();

    public ScrapeContext(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.deadline = Objects.requireNonNull(deadline, "deadline is required");
    }

    public static ScrapeContext withTimeout(Clock clock, Duration timeout) {
        return new ScrapeContext(clock, clock.instant().plus(timeout));
    }

    public Clock clock() {
        return clock;
    }

    public Instant deadline() {
        return deadline;
    }

    public void cancel() {
        cancellation.complete(null);
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void checkActive() {
        if (cancellation.isDone()) {
            throw new ScrapeCancelledException("scrape cancelled");
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new ScrapeCancelledException("scrape deadline exceeded");
        }
    }

    /**
     * Sleeps for {@code duration}, returning early with {@link ScrapeCancelledException} as soon as the
     * context is cancelled or the deadline falls inside the pause.
     */
    public void pause(Duration duration) {
        checkActive();
        Duration remaining = remaining();
        boolean truncated = remaining.compareTo(duration) < 0;
        Duration wait = truncated ? remaining : duration;
        try {
            cancellation.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException elapsed) {
            if (truncated) {
                throw new ScrapeCancelledException("scrape deadline exceeded");
            }
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeCancelledException("scrape interrupted", e);
        } catch (ExecutionException e) {
            throw new ScrapeCancelledException("scrape cancelled", e.getCause());
        }
        throw new ScrapeCancelledException("scrape cancelled");
    }

    /**
     * Waits for {@code future} within the remaining deadline. Transport failures are rethrown as the
     * original {@link IOException}; cancellation and deadline expiry cancel the future and raise
     * {@link ScrapeCancelledException}.
     */
    public <T> T await(CompletableFuture<T> future) throws IOException {
        checkActive();
        // a failed future still settles the race; its outcome is unwrapped below
        CompletableFuture<Object> either = CompletableFuture.anyOf(future.exceptionally(error -> null), cancellation);
        try {
            either.get(remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ScrapeCancelledException("scrape deadline exceeded");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScrapeCancelledException("scrape interrupted", e);
        } catch (ExecutionException e) {
            throw new ScrapeCancelledException("scrape cancelled", e.getCause());
        }

        if (!future.isDone()) {
            future.cancel(true);
            throw new ScrapeCancelledException("scrape cancelled");
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new ScrapeCancelledException("scrape cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeCancelledException("scrape interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }
}
