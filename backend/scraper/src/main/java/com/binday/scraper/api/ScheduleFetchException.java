package com.binday.scraper.api;

public class ScheduleFetchException extends ScrapeException {
    private final int status;

    public ScheduleFetchException(String message, int status) {
        super(message);
        this.status = status;
    }

    public ScheduleFetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
