package com.binday.scraper.council;

import com.binday.scraper.api.ScrapeContext;
import com.binday.scraper.api.SessionSetupException;
import com.binday.scraper.config.ScraperConfig;

import java.io.IOException;
import java.net.HttpCookie;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Performs the "save address" handshake that makes the schedule page render for our property.
 *
 * <p>The upstream sometimes answers the handshake with an error status while still setting the session
 * cookie, so the cookie is checked first and the status only decides the error message.
 */
public final class SessionAcquirer {
    private final ScraperConfig config;

    public SessionAcquirer(ScraperConfig config) {
        this.config = config;
    }

    public void acquire(ScrapeContext ctx, ScrapeSession session) {
        URI uri = sessionUri(ctx.clock().millis());
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .build();

        HttpResponse<Void> response;
        try {
            response = ctx.await(session.client().sendAsync(request, HttpResponse.BodyHandlers.discarding()));
        } catch (IOException e) {
            throw new SessionSetupException("save address request failed: " + describe(e), e);
        }

        if (headersSetSessionCookie(response.headers().allValues("set-cookie"))
                || storeHoldsSessionCookie(session.cookies().getCookieStore().get(uri))) {
            return;
        }
        int status = response.statusCode();
        if (status >= 400) {
            throw new SessionSetupException("failed to seed address session cookie: status " + status, status);
        }
        throw new SessionSetupException("failed to seed address session cookie", status);
    }

    URI sessionUri(long cacheBuster) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("uprn", config.uprn());
        putIfPresent(params, "address", config.addressLine());
        putIfPresent(params, "postcode", config.postcode());
        putIfPresent(params, "latitude", config.latitude());
        putIfPresent(params, "longitude", config.longitude());
        params.put("_", Long.toString(cacheBuster));

        StringJoiner query = new StringJoiner("&");
        params.forEach((key, value) -> query.add(
                URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)
        ));
        return URI.create(config.baseUrl() + config.sessionPath() + "?" + query);
    }

    boolean headersSetSessionCookie(List<String> setCookieHeaders) {
        for (String header : setCookieHeaders) {
            List<HttpCookie> parsed;
            try {
                parsed = HttpCookie.parse(header);
            } catch (IllegalArgumentException malformed) {
                // a malformed Set-Cookie is not the session cookie
                continue;
            }
            if (storeHoldsSessionCookie(parsed)) {
                return true;
            }
        }
        return false;
    }

    boolean storeHoldsSessionCookie(List<HttpCookie> cookies) {
        return cookies.stream().anyMatch(cookie -> config.sessionCookie().equals(cookie.getName()));
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isBlank()) {
            params.put(key, value);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
