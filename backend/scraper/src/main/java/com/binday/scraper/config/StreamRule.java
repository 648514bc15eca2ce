package com.binday.scraper.config;

import com.binday.core.model.WasteType;

import java.util.Objects;

/**
 * Selectors locating one waste stream's dates inside the schedule page.
 */
public record StreamRule(
        String containerSelector,
        String entrySelector,
        String daySelector,
        String monthSelector,
        WasteType type
) {
    public StreamRule {
        Objects.requireNonNull(containerSelector, "containerSelector is required");
        Objects.requireNonNull(entrySelector, "entrySelector is required");
        Objects.requireNonNull(daySelector, "daySelector is required");
        Objects.requireNonNull(monthSelector, "monthSelector is required");
        Objects.requireNonNull(type, "type is required");
    }
}
