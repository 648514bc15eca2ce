package com.binday.scraper.council;

import com.binday.core.model.CollectionEvent;
import com.binday.core.model.WasteType;
import com.binday.core.util.HtmlUtils;
import com.binday.scraper.api.NoCollectionsException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns harvested stream entries into dated, de-duplicated {@link CollectionEvent}s.
 */
public final class ScheduleNormalizer {
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");
    private static final DateTimeFormatter DAY_MONTH = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d MMMM")
            .toFormatter(Locale.ENGLISH);

    private final ZoneId zone;
    private final int startHour;

    public ScheduleNormalizer(ZoneId zone, int startHour) {
        this.zone = zone;
        this.startHour = startHour;
    }

    /**
     * @param today the scrape's current date in the configured zone, used when the page omits the year
     * @throws NoCollectionsException when no entry produced an event
     */
    public List<CollectionEvent> normalize(List<StreamHarvest> harvests, LocalDate today) {
        Map<String, CollectionEvent> byKey = new LinkedHashMap<>();
        Map<WasteType, Integer> created = new EnumMap<>(WasteType.class);

        for (StreamHarvest harvest : harvests) {
            WasteType type = harvest.rule().type();
            created.putIfAbsent(type, 0);
            for (RawEntry entry : harvest.entries()) {
                Optional<ZonedDateTime> date = parseDate(entry.day(), entry.month(), today);
                if (date.isEmpty()) {
                    continue;
                }
                CollectionEvent candidate = new CollectionEvent(date.get(), type, harvest.instructions(), entry.note());
                CollectionEvent existing = byKey.get(candidate.key());
                if (existing == null) {
                    byKey.put(candidate.key(), candidate);
                    created.merge(type, 1, Integer::sum);
                } else {
                    byKey.put(candidate.key(), merge(existing, candidate));
                }
            }
        }

        List<CollectionEvent> events = new ArrayList<>(byKey.values());
        propagateGardenNotice(harvests, created, events);

        if (events.isEmpty()) {
            throw new NoCollectionsException();
        }
        events.sort(Comparator.comparing(event -> event.date().toInstant()));
        return List.copyOf(events);
    }

    /**
     * Fills gaps in {@code existing} from {@code repeat}; populated fields are never overwritten.
     */
    static CollectionEvent merge(CollectionEvent existing, CollectionEvent repeat) {
        CollectionEvent merged = existing;
        if (merged.note().isEmpty() && !repeat.note().isEmpty()) {
            merged = merged.withNote(repeat.note());
        }
        if (merged.instructions().isEmpty() && !repeat.instructions().isEmpty()) {
            merged = merged.withInstructions(repeat.instructions());
        }
        return merged;
    }

    /**
     * When the garden container is present but lists no dates, its notice (typically "service paused until
     * ...") is copied onto every other stream's note instead of producing garden events.
     */
    private static void propagateGardenNotice(
            List<StreamHarvest> harvests,
            Map<WasteType, Integer> created,
            List<CollectionEvent> events
    ) {
        String notice = harvests.stream()
                .filter(harvest -> harvest.rule().type() == WasteType.GARDEN_WASTE)
                .filter(harvest -> created.getOrDefault(WasteType.GARDEN_WASTE, 0) == 0)
                .map(StreamHarvest::notice)
                .filter(text -> !text.isBlank())
                .findFirst()
                .orElse("");
        if (notice.isEmpty()) {
            return;
        }
        events.replaceAll(event -> event.type() == WasteType.GARDEN_WASTE
                ? event
                : event.withNote(appendNote(event.note(), notice)));
    }

    static String appendNote(String existing, String extra) {
        String current = existing == null ? "" : existing.trim();
        String addition = extra == null ? "" : extra.trim();
        if (addition.isEmpty()) {
            return current;
        }
        if (current.isEmpty()) {
            return addition;
        }
        if (current.contains(addition)) {
            return current;
        }
        return current + "\n" + addition;
    }

    Optional<ZonedDateTime> parseDate(String dayText, String monthText, LocalDate today) {
        Matcher dayDigits = DIGITS.matcher(dayText);
        if (!dayDigits.find()) {
            return Optional.empty();
        }

        Integer explicitYear = null;
        String month = monthText;
        Matcher yearMatcher = YEAR.matcher(monthText);
        if (yearMatcher.find()) {
            explicitYear = Integer.parseInt(yearMatcher.group(1));
            month = yearMatcher.replaceAll(" ");
        }
        month = HtmlUtils.normalizeSpaces(month);
        if (month.isEmpty()) {
            return Optional.empty();
        }

        MonthDay monthDay;
        try {
            monthDay = MonthDay.parse(Integer.parseInt(dayDigits.group()) + " " + month, DAY_MONTH);
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }

        LocalDate date = explicitYear != null ? monthDay.atYear(explicitYear) : nearestYear(monthDay, today);
        return Optional.of(ZonedDateTime.of(date, LocalTime.of(startHour, 0), zone));
    }

    /**
     * Places a year-less date in whichever of last, this or next year lies closest to {@code today}.
     * Ties go to the later year.
     */
    static LocalDate nearestYear(MonthDay monthDay, LocalDate today) {
        LocalDate best = null;
        long bestDistance = Long.MAX_VALUE;
        for (int year = today.getYear() - 1; year <= today.getYear() + 1; year++) {
            LocalDate candidate = monthDay.atYear(year);
            long distance = Math.abs(ChronoUnit.DAYS.between(today, candidate));
            if (distance <= bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
