package com.binday.scraper.api;

public class ScheduleParseException extends ScrapeException {
    public ScheduleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
