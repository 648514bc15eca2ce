package com.binday.scraper.council;

import com.binday.scraper.api.ScheduleFetchException;
import com.binday.scraper.api.ScrapeContext;
import com.binday.scraper.config.ScraperConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

public final class ScheduleFetcher {
    private final ScraperConfig config;

    public ScheduleFetcher(ScraperConfig config) {
        this.config = config;
    }

    /**
     * Waits the courtesy pause, then downloads the schedule page with the session's cookies.
     */
    public byte[] fetch(ScrapeContext ctx, ScrapeSession session) {
        ctx.pause(config.courtesyPause());

        URI uri = URI.create(config.baseUrl() + config.schedulePath());
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .build();

        HttpResponse<byte[]> response;
        try {
            response = ctx.await(session.client().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()));
        } catch (IOException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new ScheduleFetchException("fetch schedule: " + reason, e);
        }

        if (response.statusCode() >= 400) {
            throw new ScheduleFetchException(
                    "fetch schedule: unexpected status " + response.statusCode(),
                    response.statusCode()
            );
        }
        return response.body();
    }
}
