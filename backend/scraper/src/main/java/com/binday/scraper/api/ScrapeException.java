package com.binday.scraper.api;

/**
 * Base type for every failure of a scrape cycle. The scraper never retries and never swallows these; they
 * propagate to whoever requested the collections.
 */
public class ScrapeException extends RuntimeException {
    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
