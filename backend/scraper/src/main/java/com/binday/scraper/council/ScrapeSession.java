package com.binday.scraper.council;

import java.net.CookieManager;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * HTTP client and cookie jar scoped to a single scrape: the address handshake seeds the jar and the
 * schedule request reuses it.
 */
public record ScrapeSession(HttpClient client, CookieManager cookies) {
    public ScrapeSession {
        Objects.requireNonNull(client, "client is required");
        Objects.requireNonNull(cookies, "cookies is required");
    }
}
