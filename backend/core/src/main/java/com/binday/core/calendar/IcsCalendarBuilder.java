package com.binday.core.calendar;

import com.binday.core.model.CollectionEvent;
import com.binday.core.model.Instruction;
import com.binday.core.schedule.DayResolver;
import com.binday.core.util.HtmlUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Renders collection events as an RFC 5545 iCalendar document.
 *
 * <p>Output is a pure function of the input list: UIDs are derived from the stream slug and local date,
 * and DTSTAMP is pinned to the event start, so regenerating the feed yields identical bytes.
 */
public class IcsCalendarBuilder implements CalendarBuilder {
    public static final String PRODUCT_ID = "-//redbridge-ics//EN";
    public static final String UID_DOMAIN = "redbridge-ics";

    private static final String CRLF = "\r\n";
    private static final int MAX_LINE_OCTETS = 75;
    private static final String BULLET = "• ";
    private static final DateTimeFormatter UTC_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final DateTimeFormatter UID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final CalendarSettings settings;

    public IcsCalendarBuilder(CalendarSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    @Override
    public byte[] build(List<CollectionEvent> events) {
        StringBuilder out = new StringBuilder();
        line(out, "BEGIN:VCALENDAR");
        line(out, "VERSION:2.0");
        line(out, "PRODID:" + PRODUCT_ID);
        line(out, "CALSCALE:GREGORIAN");
        line(out, "METHOD:PUBLISH");
        if (!settings.name().isEmpty()) {
            line(out, "NAME:" + escape(settings.name()));
            line(out, "X-WR-CALNAME:" + escape(settings.name()));
        }
        if (!settings.description().isEmpty()) {
            line(out, "X-WR-CALDESC:" + escape(settings.description()));
        }
        line(out, "X-WR-TIMEZONE:" + settings.zone().getId());

        for (CollectionEvent event : events) {
            writeEvent(out, event);
        }

        line(out, "END:VCALENDAR");
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Stable identifier for the logical collection: same stream on the same local date, same UID.
     */
    public String uid(CollectionEvent event) {
        String day = event.date().withZoneSameInstant(settings.zone()).format(UID_DATE);
        return HtmlUtils.slugify(event.type().label()) + "-" + day + "@" + UID_DOMAIN;
    }

    private void writeEvent(StringBuilder out, CollectionEvent event) {
        ZonedDateTime start = event.date().withZoneSameInstant(ZoneOffset.UTC);
        ZonedDateTime end = start.plus(DayResolver.COLLECTION_WINDOW);
        String summary = "Bin: " + HtmlUtils.titleCase(event.type().label());

        line(out, "BEGIN:VEVENT");
        line(out, "UID:" + uid(event));
        line(out, "DTSTAMP:" + start.format(UTC_STAMP));
        line(out, "DTSTART:" + start.format(UTC_STAMP));
        line(out, "DTEND:" + end.format(UTC_STAMP));
        line(out, "SUMMARY:" + escape(summary));
        line(out, "CATEGORIES:" + escape(event.type().label()));
        line(out, "DESCRIPTION:" + escape(description(event)));
        line(out, "TRANSP:TRANSPARENT");
        alarm(out, "-PT11H", summary);
        alarm(out, "-PT30M", summary);
        line(out, "END:VEVENT");
    }

    private void alarm(StringBuilder out, String trigger, String summary) {
        line(out, "BEGIN:VALARM");
        line(out, "ACTION:DISPLAY");
        line(out, "TRIGGER:" + trigger);
        line(out, "DESCRIPTION:" + escape(summary));
        line(out, "END:VALARM");
    }

    String description(CollectionEvent event) {
        List<String> sections = new ArrayList<>();

        List<String> instructionLines = new ArrayList<>();
        Set<String> missedLinks = new LinkedHashSet<>();
        Set<String> otherLinks = new LinkedHashSet<>();
        for (Instruction instruction : event.instructions()) {
            instructionLines.add(instruction.text());
            boolean missedText = mentionsMissed(instruction.text());
            for (String link : instruction.links()) {
                if (missedText || mentionsMissed(linkPath(link))) {
                    missedLinks.add(link);
                } else {
                    otherLinks.add(link);
                }
            }
        }
        otherLinks.removeAll(missedLinks);
        if (instructionLines.isEmpty()) {
            ZonedDateTime local = event.date().withZoneSameInstant(settings.zone());
            instructionLines.add(String.format(
                    Locale.ROOT,
                    "Place bins out by %02d:%02d on collection day.",
                    local.getHour(),
                    local.getMinute()
            ));
        }

        sections.add(section("INSTRUCTIONS", instructionLines));
        if (!missedLinks.isEmpty()) {
            sections.add(section("MISSED COLLECTION", missedLinks));
        }
        if (!otherLinks.isEmpty()) {
            sections.add(section("LINKS", otherLinks));
        }
        List<String> noteLines = event.note().lines()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
        if (!noteLines.isEmpty()) {
            sections.add(section("NOTE", noteLines));
        }
        return String.join("\n\n", sections);
    }

    private static String section(String heading, Iterable<String> bullets) {
        StringBuilder body = new StringBuilder(heading);
        for (String bullet : bullets) {
            body.append('\n').append(BULLET).append(bullet);
        }
        return body.toString();
    }

    private static boolean mentionsMissed(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains("missed");
    }

    private static String linkPath(String link) {
        try {
            return URI.create(link).getPath();
        } catch (IllegalArgumentException e) {
            return link;
        }
    }

    static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case ';' -> out.append("\\;");
                case ',' -> out.append("\\,");
                case '\n' -> out.append("\\n");
                case '\r' -> {
                }
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Appends a content line folded at 75 octets; continuation lines start with a single space and never
     * split a UTF-8 sequence.
     */
    static void line(StringBuilder out, String content) {
        int octets = 0;
        int limit = MAX_LINE_OCTETS;
        int i = 0;
        while (i < content.length()) {
            int codePoint = content.codePointAt(i);
            int width = utf8Length(codePoint);
            if (octets + width > limit) {
                out.append(CRLF).append(' ');
                octets = 0;
                limit = MAX_LINE_OCTETS - 1;
            }
            out.appendCodePoint(codePoint);
            octets += width;
            i += Character.charCount(codePoint);
        }
        out.append(CRLF);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
