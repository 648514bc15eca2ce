package com.binday.service.config;

import com.binday.core.util.JsonUtils;
import com.binday.scraper.config.ScraperConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code binday.json} from the config directory (optional) and overlays environment variables on top.
 */
public final class ConfigLoader {
    public static final String FILE_NAME = "binday.json";

    static final String DEFAULT_BASE_URL = "https://my.redbridge.gov.uk";
    static final String DEFAULT_SCHEDULE_PATH = "/RecycleRefuse";
    static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(168);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);
    static final int DEFAULT_START_HOUR = 6;
    static final int DEFAULT_PORT = 8080;
    static final String DEFAULT_TIMEZONE = "Europe/London";
    static final String DEFAULT_CALENDAR_NAME = "Redbridge Collections";
    static final String DEFAULT_CALENDAR_DESCRIPTION = "Household waste & recycling (scraped)";

    private static final Pattern COMPACT_DURATION_PART = Pattern.compile("(\\d+)(ms|h|m|s)");

    private ConfigLoader() {
    }

    public static ServiceConfig load(Path configDir, Map<String, String> env) {
        FileSettings file = readOptional(configDir.resolve(FILE_NAME));

        String uprn = pick(env, "UPRN", file.uprn(), "");
        if (uprn.isBlank()) {
            throw new IllegalStateException("UPRN is required");
        }

        int startHour = parseInt("START_HOUR", pick(env, "START_HOUR", asText(file.startHour()), Integer.toString(DEFAULT_START_HOUR)));
        if (startHour < 0 || startHour > 23) {
            throw new IllegalStateException("START_HOUR must be between 0 and 23");
        }
        int port = parseInt("LISTEN_PORT", pick(env, "LISTEN_PORT", asText(file.listenPort()), Integer.toString(DEFAULT_PORT)));

        Duration timeout = parseDuration("SCRAPE_TIMEOUT", pick(env, "SCRAPE_TIMEOUT", file.scrapeTimeout(), null), DEFAULT_REQUEST_TIMEOUT);
        Duration cacheTtl = parseDuration("CACHE_TTL", pick(env, "CACHE_TTL", file.cacheTtl(), null), DEFAULT_CACHE_TTL);
        ZoneId zone = parseZone(pick(env, "TIMEZONE", file.timezone(), DEFAULT_TIMEZONE));

        ScraperConfig scraper = new ScraperConfig(
                trimTrailingSlash(pick(env, "BASE_URL", file.baseUrl(), DEFAULT_BASE_URL)),
                ensureLeadingSlash(pick(env, "SCHEDULE_PATH", file.schedulePath(), DEFAULT_SCHEDULE_PATH)),
                ensureLeadingSlash(pick(env, "SESSION_PATH", file.sessionPath(), ScraperConfig.DEFAULT_SESSION_PATH)),
                pick(env, "SESSION_COOKIE", file.sessionCookie(), ScraperConfig.DEFAULT_SESSION_COOKIE),
                uprn.trim(),
                pick(env, "ADDRESS_LINE", file.addressLine(), ""),
                pick(env, "POSTCODE", file.postcode(), ""),
                pick(env, "LATITUDE", file.latitude(), ""),
                pick(env, "LONGITUDE", file.longitude(), ""),
                pick(env, "USER_AGENT", file.userAgent(), ScraperConfig.DEFAULT_USER_AGENT),
                startHour,
                timeout,
                ScraperConfig.DEFAULT_COURTESY_PAUSE,
                zone
        );

        return new ServiceConfig(
                port,
                scraper,
                cacheTtl,
                pick(env, "CALENDAR_NAME", file.calendarName(), DEFAULT_CALENDAR_NAME),
                pick(env, "CALENDAR_DESCRIPTION", file.calendarDescription(), DEFAULT_CALENDAR_DESCRIPTION)
        );
    }

    /**
     * Accepts ISO-8601 ({@code PT15S}) or compact forms such as {@code 15s}, {@code 168h} or {@code 1h30m}.
     */
    static Duration parseDuration(String key, String raw, Duration fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.startsWith("P") || value.startsWith("p")) {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("invalid duration for " + key + ": " + raw, e);
            }
        }

        Matcher matcher = COMPACT_DURATION_PART.matcher(value);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                break;
            }
            long amount = Long.parseLong(matcher.group(1));
            total = total.plus(switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            });
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != value.length()) {
            throw new IllegalStateException("invalid duration for " + key + ": " + raw);
        }
        return total;
    }

    private static FileSettings readOptional(Path path) {
        if (!Files.exists(path)) {
            return FileSettings.EMPTY;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, FileSettings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static String pick(Map<String, String> env, String key, String fileValue, String fallback) {
        String fromEnv = env.get(key);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        if (fileValue != null && !fileValue.isBlank()) {
            return fileValue;
        }
        return fallback;
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("invalid integer for " + key + ": " + raw, e);
        }
    }

    private static ZoneId parseZone(String raw) {
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("invalid TIMEZONE: " + raw, e);
        }
    }

    private static String asText(Integer value) {
        return value == null ? null : value.toString();
    }

    private static String trimTrailingSlash(String value) {
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String ensureLeadingSlash(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("/")) {
            return trimmed;
        }
        return "/" + trimmed;
    }

    record FileSettings(
            Integer listenPort,
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
            Integer startHour,
            String scrapeTimeout,
            String cacheTtl,
            String timezone,
            String calendarName,
            String calendarDescription
    ) {
        static final FileSettings EMPTY = new FileSettings(
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null
        );
    }
}
