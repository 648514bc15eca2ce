package com.binday.core.calendar;

import java.time.ZoneId;
import java.util.Objects;

public record CalendarSettings(String name, String description, ZoneId zone) {
    public CalendarSettings {
        Objects.requireNonNull(zone, "zone is required");
        name = name == null ? "" : name.trim();
        description = description == null ? "" : description.trim();
    }
}
