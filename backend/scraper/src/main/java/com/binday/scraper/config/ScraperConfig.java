package com.binday.scraper.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

public record ScraperConfig(
        String baseUrl,
        String schedulePath,
        String sessionPath,
        String sessionCookie,
        String uprn,
        String addressLine,
        String postcode,
        String latitude,
        String longitude,
        String userAgent,
        int startHour,
        Duration requestTimeout,
        Duration courtesyPause,
        ZoneId zone
) {
    public static final String DEFAULT_SESSION_PATH = "/Shared/SaveAddress";
    public static final String DEFAULT_SESSION_COOKIE = "RedbridgeIV3LivePref";
    public static final String DEFAULT_USER_AGENT = "redbridge-council-rubbish-scraper/1.0";
    public static final Duration DEFAULT_COURTESY_PAUSE = Duration.ofMillis(150);

    public ScraperConfig {
        if (baseUrl == null || baseUrl.isBlank() || schedulePath == null || schedulePath.isBlank()) {
            throw new IllegalArgumentException("base URL and schedule path are required");
        }
        if (uprn == null || uprn.isBlank()) {
            throw new IllegalArgumentException("UPRN is required");
        }
        if (startHour < 0 || startHour > 23) {
            throw new IllegalArgumentException("start hour must be between 0 and 23");
        }
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        Objects.requireNonNull(zone, "zone is required");
        sessionPath = sessionPath == null || sessionPath.isBlank() ? DEFAULT_SESSION_PATH : sessionPath;
        sessionCookie = sessionCookie == null || sessionCookie.isBlank() ? DEFAULT_SESSION_COOKIE : sessionCookie;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        courtesyPause = courtesyPause == null ? DEFAULT_COURTESY_PAUSE : courtesyPause;
        addressLine = addressLine == null ? "" : addressLine;
        postcode = postcode == null ? "" : postcode;
        latitude = latitude == null ? "" : latitude;
        longitude = longitude == null ? "" : longitude;
    }

    /**
     * Minimal configuration for one property; everything else takes the council defaults.
     */
    public static ScraperConfig forProperty(String baseUrl, String schedulePath, String uprn, ZoneId zone) {
        return new ScraperConfig(
                baseUrl,
                schedulePath,
                null,
                null,
                uprn,
                null,
                null,
                null,
                null,
                null,
                6,
                Duration.ofSeconds(15),
                null,
                zone
        );
    }

    public ScraperConfig withCourtesyPause(Duration pause) {
        return new ScraperConfig(baseUrl, schedulePath, sessionPath, sessionCookie, uprn, addressLine, postcode,
                latitude, longitude, userAgent, startHour, requestTimeout, pause, zone);
    }

    public ScraperConfig withRequestTimeout(Duration timeout) {
        return new ScraperConfig(baseUrl, schedulePath, sessionPath, sessionCookie, uprn, addressLine, postcode,
                latitude, longitude, userAgent, startHour, timeout, courtesyPause, zone);
    }

    public ScraperConfig withAddress(String line, String postalCode, String lat, String lon) {
        return new ScraperConfig(baseUrl, schedulePath, sessionPath, sessionCookie, uprn, line, postalCode,
                lat, lon, userAgent, startHour, requestTimeout, courtesyPause, zone);
    }
}
