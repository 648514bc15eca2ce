package com.binday.scraper.api;

import com.binday.core.model.CollectionEvent;

import java.util.List;

public interface ScheduleSource {
    /**
     * Runs one full scrape cycle and returns the normalized events sorted by date.
     *
     * @throws ScrapeException on any handshake, transport, parse or cancellation failure
     */
    List<CollectionEvent> fetchCollections(ScrapeContext ctx);
}
