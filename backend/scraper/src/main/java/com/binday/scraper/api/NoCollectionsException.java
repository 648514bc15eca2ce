package com.binday.scraper.api;

/**
 * The schedule document was fetched and parsed but yielded no collection events. Usually means the council
 * changed its markup or the page is temporarily empty.
 */
public class NoCollectionsException extends ScrapeException {
    public NoCollectionsException() {
        super("no collections found in schedule");
    }
}
