package com.binday.core.model;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Streams collected on one calendar date. {@code date} is the earliest collection time on that date.
 */
public record DaySummary(ZonedDateTime date, List<String> types) {
    public DaySummary {
        Objects.requireNonNull(date, "date is required");
        types = List.copyOf(types);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("types must not be empty");
        }
    }
}
