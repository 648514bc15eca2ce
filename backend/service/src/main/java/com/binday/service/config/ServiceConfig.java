package com.binday.service.config;

import com.binday.scraper.config.ScraperConfig;

import java.time.Duration;
import java.util.Objects;

public record ServiceConfig(
        int listenPort,
        ScraperConfig scraper,
        Duration cacheTtl,
        String calendarName,
        String calendarDescription
) {
    public ServiceConfig {
        Objects.requireNonNull(scraper, "scraper is required");
        Objects.requireNonNull(cacheTtl, "cacheTtl is required");
    }
}
