package com.binday.service.api;

import com.binday.core.calendar.CalendarBuilder;
import com.binday.core.model.CollectionEvent;
import com.binday.core.model.DaySummary;
import com.binday.core.schedule.DayResolver;
import com.binday.core.util.JsonUtils;
import com.binday.scraper.api.NoCollectionsException;
import com.binday.scraper.api.ScheduleParseException;
import com.binday.scraper.api.SessionSetupException;
import com.binday.service.runtime.CollectionService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String CALENDAR_CONTENT_TYPE = "text/calendar; charset=utf-8";
    private static final String CALENDAR_CACHE_CONTROL = "public, max-age=300";

    private final int port;
    private final CollectionService collectionService;
    private final CalendarBuilder calendarBuilder;
    private final DayResolver dayResolver;
    private final ScrapeDiagnostics diagnostics;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            CollectionService collectionService,
            CalendarBuilder calendarBuilder,
            DayResolver dayResolver,
            ScrapeDiagnostics diagnostics,
            Clock clock
    ) {
        this.port = port;
        this.collectionService = collectionService;
        this.calendarBuilder = calendarBuilder;
        this.dayResolver = dayResolver;
        this.diagnostics = diagnostics == null ? ScrapeDiagnostics.empty() : diagnostics;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/healthz", this::handleHealth);
            server.createContext("/calendar.ics", this::handleCalendar);
            server.createContext("/api/next", this::handleNext);
            server.createContext("/api/types", this::handleTypes);
            server.createContext("/api/is-today", this::handleIsToday);
            server.createContext("/api/is-tomorrow", this::handleIsTomorrow);
            server.createContext("/metrics", this::handleMetrics);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleCalendar(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());

        List<CollectionEvent> events;
        try {
            events = collectionService.collections(isRefresh(query));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "scrape failed: " + e.getMessage(), e);
            writeJson(exchange, 502, Map.of("error", scrapeErrorCode(e)));
            return;
        }

        byte[] payload;
        try {
            payload = calendarBuilder.build(events);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "calendar build failed: " + e.getMessage(), e);
            writeJson(exchange, 500, Map.of("error", "calendar_failed"));
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", CALENDAR_CONTENT_TYPE);
        exchange.getResponseHeaders().set("Cache-Control", CALENDAR_CACHE_CONTROL);
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private void handleNext(HttpExchange exchange) throws IOException {
        Optional<Lookup> lookup = lookup(exchange);
        if (lookup.isEmpty()) {
            return;
        }
        Instant now = lookup.get().now();
        Optional<DaySummary> next = dayResolver.next(now, lookup.get().events());
        if (next.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_upcoming_collections"));
            return;
        }

        DaySummary day = next.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("date", day.date().withZoneSameInstant(dayResolver.zone()).format(DateTimeFormatter.ISO_LOCAL_DATE));
        body.put("days", dayResolver.daysBetween(now, day));
        body.put("types", day.types());
        writeJson(exchange, 200, body);
    }

    private void handleTypes(HttpExchange exchange) throws IOException {
        Optional<Lookup> lookup = lookup(exchange);
        if (lookup.isEmpty()) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("today", dayResolver.today(lookup.get().now(), lookup.get().events()));
        body.put("tomorrow", dayResolver.tomorrow(lookup.get().now(), lookup.get().events()));
        writeJson(exchange, 200, body);
    }

    private void handleIsToday(HttpExchange exchange) throws IOException {
        Optional<Lookup> lookup = lookup(exchange);
        if (lookup.isEmpty()) {
            return;
        }
        List<String> types = dayResolver.today(lookup.get().now(), lookup.get().events());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("today", !types.isEmpty());
        body.put("types", types);
        writeJson(exchange, 200, body);
    }

    private void handleIsTomorrow(HttpExchange exchange) throws IOException {
        Optional<Lookup> lookup = lookup(exchange);
        if (lookup.isEmpty()) {
            return;
        }
        List<String> types = dayResolver.tomorrow(lookup.get().now(), lookup.get().events());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tomorrow", !types.isEmpty());
        body.put("types", types);
        writeJson(exchange, 200, body);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        writeJson(exchange, 200, diagnostics.snapshot());
    }

    /**
     * Resolves {@code now} and the collections for an {@code /api/*} request, writing the error response
     * itself when either step fails.
     */
    private Optional<Lookup> lookup(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return Optional.empty();
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());

        Instant now;
        try {
            now = resolveNow(query.get("now"));
        } catch (DateTimeParseException invalidNow) {
            writeJson(exchange, 400, Map.of("error", "invalid_now"));
            return Optional.empty();
        }

        try {
            return Optional.of(new Lookup(now, collectionService.collections(isRefresh(query))));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "collections unavailable: " + e.getMessage(), e);
            writeJson(exchange, 503, Map.of("error", "unavailable"));
            return Optional.empty();
        }
    }

    private Instant resolveNow(String raw) {
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        // an unencoded "+01:00" offset arrives form-decoded as a space
        String value = raw.trim().replace(' ', '+');
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    static String scrapeErrorCode(RuntimeException error) {
        if (error instanceof SessionSetupException) {
            return "address_setup_failed";
        }
        if (error instanceof NoCollectionsException || error instanceof ScheduleParseException) {
            return "failed_to_parse_schedule";
        }
        return "scrape_failed";
    }

    private static boolean isRefresh(Map<String, String> query) {
        return "true".equalsIgnoreCase(query.getOrDefault("refresh", ""));
    }

    private boolean ensureGet(HttpExchange exchange, boolean corsEnabled) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            if (corsEnabled) {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    private record Lookup(Instant now, List<CollectionEvent> events) {
    }
}
