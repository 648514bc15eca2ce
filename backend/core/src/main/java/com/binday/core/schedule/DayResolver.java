package com.binday.core.schedule;

import com.binday.core.model.CollectionEvent;
import com.binday.core.model.DaySummary;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers "today / tomorrow / next" questions over a list of collection events.
 *
 * <p>A collection counts as "today" only until its one-hour collection window has elapsed. Calendar dates
 * are always taken in the configured zone, so an instant supplied in UTC is compared against local days.
 */
public final class DayResolver {
    public static final Duration COLLECTION_WINDOW = Duration.ofHours(1);

    private final ZoneId zone;

    public DayResolver(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    public ZoneId zone() {
        return zone;
    }

    public List<DaySummary> groupByDay(List<CollectionEvent> events) {
        List<CollectionEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(event -> event.date().toInstant()));

        Map<LocalDate, ZonedDateTime> firstSeen = new LinkedHashMap<>();
        Map<LocalDate, List<String>> typesByDay = new LinkedHashMap<>();
        for (CollectionEvent event : sorted) {
            ZonedDateTime local = event.date().withZoneSameInstant(zone);
            LocalDate day = local.toLocalDate();
            firstSeen.putIfAbsent(day, local);
            List<String> types = typesByDay.computeIfAbsent(day, ignored -> new ArrayList<>());
            if (!types.contains(event.type().label())) {
                types.add(event.type().label());
            }
        }

        List<DaySummary> days = new ArrayList<>();
        firstSeen.keySet().stream()
                .sorted()
                .forEach(day -> days.add(new DaySummary(firstSeen.get(day), typesByDay.get(day))));
        return days;
    }

    public List<String> today(Instant now, List<CollectionEvent> events) {
        LocalDate nowDay = localDate(now);
        for (DaySummary day : groupByDay(events)) {
            if (day.date().toLocalDate().equals(nowDay) && withinWindow(now, day)) {
                return day.types();
            }
        }
        return List.of();
    }

    public List<String> tomorrow(Instant now, List<CollectionEvent> events) {
        LocalDate target = localDate(now).plusDays(1);
        for (DaySummary day : groupByDay(events)) {
            if (day.date().toLocalDate().equals(target)) {
                return day.types();
            }
        }
        return List.of();
    }

    public Optional<DaySummary> next(Instant now, List<CollectionEvent> events) {
        LocalDate nowDay = localDate(now);
        for (DaySummary day : groupByDay(events)) {
            LocalDate date = day.date().toLocalDate();
            if (date.isBefore(nowDay)) {
                continue;
            }
            if (day.date().toInstant().isAfter(now) || withinWindow(now, day)) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }

    /**
     * Whole calendar days from {@code now} to {@code day}, midnight to midnight, ignoring time of day.
     */
    public long daysBetween(Instant now, DaySummary day) {
        return ChronoUnit.DAYS.between(localDate(now), day.date().withZoneSameInstant(zone).toLocalDate());
    }

    private boolean withinWindow(Instant now, DaySummary day) {
        return now.isBefore(day.date().toInstant().plus(COLLECTION_WINDOW));
    }

    private LocalDate localDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }
}
