package com.binday.service.api;

import com.binday.core.calendar.CalendarSettings;
import com.binday.core.calendar.IcsCalendarBuilder;
import com.binday.core.model.CollectionEvent;
import com.binday.core.model.WasteType;
import com.binday.core.schedule.DayResolver;
import com.binday.core.util.JsonUtils;
import com.binday.scraper.api.NoCollectionsException;
import com.binday.scraper.api.ScheduleFetchException;
import com.binday.scraper.api.SessionSetupException;
import com.binday.service.cache.CollectionCache;
import com.binday.service.runtime.CollectionService;
import com.binday.service.support.MutableClock;
import com.binday.service.support.ScriptedScheduleSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerIntegrationTest {
    private static final ZoneId LONDON = ZoneId.of("Europe/London");
    private static final List<CollectionEvent> DECEMBER = List.of(
            event("2025-12-01T06:00", WasteType.REFUSE),
            event("2025-12-02T06:00", WasteType.RECYCLING),
            event("2025-12-02T06:00", WasteType.FOOD_WASTE)
    );

    private final MutableClock clock = new MutableClock(Instant.parse("2025-12-01T07:30:00Z"), ZoneOffset.UTC);
    private final ScriptedScheduleSource source = new ScriptedScheduleSource();
    private final HttpClient client = HttpClient.newHttpClient();
    private ApiServer apiServer;

    @AfterEach
    void tearDown() {
        if (apiServer != null) {
            apiServer.stop();
        }
    }

    @Test
    void healthEndpointReturnsOk() throws Exception {
        startServer();

        HttpResponse<String> response = get("/healthz");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"status\":\"ok\""));
        assertEquals(0, source.calls());
    }

    @Test
    void calendarEndpointServesIcsWithCachingHeaders() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        HttpResponse<String> response = get("/calendar.ics");

        assertEquals(200, response.statusCode());
        assertEquals("text/calendar; charset=utf-8", response.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("public, max-age=300", response.headers().firstValue("Cache-Control").orElseThrow());
        assertTrue(response.body().startsWith("BEGIN:VCALENDAR\r\n"));
        assertTrue(response.body().contains("UID:recycling-20251202@redbridge-ics\r\n"));
        assertTrue(response.body().contains("X-WR-CALNAME:Redbridge Collections\r\n"));
    }

    @Test
    void calendarEndpointMapsScrapeFailuresToBadGateway() throws Exception {
        source.thenThrow(new SessionSetupException("failed to seed address session cookie: status 500", 500))
                .thenThrow(new NoCollectionsException())
                .thenThrow(new ScheduleFetchException("fetch schedule: unexpected status 503", 503));
        startServer();

        assertError(get("/calendar.ics"), 502, "address_setup_failed");
        assertError(get("/calendar.ics"), 502, "failed_to_parse_schedule");
        assertError(get("/calendar.ics"), 502, "scrape_failed");
    }

    @Test
    void nextReportsFollowingDayOnceTodaysWindowHasPassed() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        HttpResponse<String> response = get("/api/next");

        assertEquals(200, response.statusCode());
        JsonNode body = JsonUtils.objectMapper().readTree(response.body());
        assertEquals("2025-12-02", body.get("date").asText());
        assertEquals(1, body.get("days").asInt());
        assertEquals("Recycling", body.get("types").get(0).asText());
        assertEquals("Food Waste", body.get("types").get(1).asText());
    }

    @Test
    void nextHonoursExplicitNowIncludingUnencodedOffset() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        JsonNode utc = json(get("/api/next?now=2025-12-01T06:15:00Z"));
        JsonNode offset = json(get("/api/next?now=2025-12-01T07:15:00+01:00"));

        assertEquals("2025-12-01", utc.get("date").asText());
        assertEquals(0, utc.get("days").asInt());
        assertEquals("2025-12-01", offset.get("date").asText());
        assertEquals(1, source.calls());
    }

    @Test
    void nextReturnsNotFoundWhenNothingUpcoming() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        assertError(get("/api/next?now=2025-12-05T00:00:00Z"), 404, "no_upcoming_collections");
    }

    @Test
    void invalidNowIsRejectedBeforeScraping() throws Exception {
        startServer();

        assertError(get("/api/types?now=yesterday"), 400, "invalid_now");
        assertError(get("/api/next?now=2025-12-01"), 400, "invalid_now");
        assertEquals(0, source.calls());
    }

    @Test
    void typesReportsTodayAndTomorrow() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        JsonNode inWindow = json(get("/api/types?now=2025-12-01T06:30:00Z"));
        JsonNode afterWindow = json(get("/api/types?now=2025-12-01T07:00:00Z"));

        assertEquals("Refuse", inWindow.get("today").get(0).asText());
        assertEquals(2, inWindow.get("tomorrow").size());
        assertEquals(0, afterWindow.get("today").size());
        assertEquals(2, afterWindow.get("tomorrow").size());
    }

    @Test
    void isTodayAndIsTomorrowReturnFlagsWithTypes() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();

        JsonNode today = json(get("/api/is-today?now=2025-12-01T06:10:00Z"));
        JsonNode tomorrow = json(get("/api/is-tomorrow?now=2025-12-02T10:00:00Z"));

        assertTrue(today.get("today").asBoolean());
        assertEquals("Refuse", today.get("types").get(0).asText());
        assertEquals(false, tomorrow.get("tomorrow").asBoolean());
        assertEquals(0, tomorrow.get("types").size());
    }

    @Test
    void apiLookupsReportUnavailableWhenScrapeFails() throws Exception {
        source.thenThrow(new ScheduleFetchException("fetch schedule: unexpected status 503", 503));
        startServer();

        assertError(get("/api/is-today"), 503, "unavailable");
    }

    @Test
    void refreshParameterBypassesCache() throws Exception {
        source.thenReturn(DECEMBER).thenReturn(List.of(event("2025-12-03T06:00", WasteType.GARDEN_WASTE)));
        startServer();

        get("/api/next");
        get("/api/next");
        JsonNode refreshed = json(get("/api/next?refresh=true"));

        assertEquals(2, source.calls());
        assertEquals("Garden Waste", refreshed.get("types").get(0).asText());
    }

    @Test
    void metricsExposeCacheAndScrapeCounters() throws Exception {
        source.thenReturn(DECEMBER);
        startServer();
        get("/api/next");
        get("/api/next");

        JsonNode metrics = json(get("/metrics"));

        assertEquals(1, metrics.get("cacheMisses").asInt());
        assertEquals(1, metrics.get("cacheHits").asInt());
        assertEquals(1, metrics.get("scrapesTotal").asInt());
        assertEquals(3, metrics.get("lastScrape").get("lastEventCount").asInt());
        JsonNode durations = metrics.get("scrapeDurationSeconds");
        assertEquals(1, durations.get("count").asInt());
        JsonNode buckets = durations.get("buckets");
        assertEquals("+Inf", buckets.get(buckets.size() - 1).get("le").asText());
        assertEquals(1, buckets.get(buckets.size() - 1).get("count").asInt());
    }

    @Test
    void onlyGetAndOptionsAreAllowed() throws Exception {
        startServer();

        HttpResponse<String> post = client.send(
                HttpRequest.newBuilder(uri("/api/next")).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString()
        );
        HttpResponse<String> options = client.send(
                HttpRequest.newBuilder(uri("/calendar.ics")).method("OPTIONS", HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString()
        );

        assertEquals(405, post.statusCode());
        assertEquals(204, options.statusCode());
        assertEquals("*", options.headers().firstValue("Access-Control-Allow-Origin").orElseThrow());
        assertEquals(0, source.calls());
    }

    private void startServer() {
        ScrapeDiagnostics diagnostics = new ScrapeDiagnostics(clock);
        CollectionService service = new CollectionService(
                source,
                new CollectionCache(clock),
                Duration.ofHours(168),
                Duration.ofSeconds(15),
                clock,
                diagnostics
        );
        apiServer = new ApiServer(
                0,
                service,
                new IcsCalendarBuilder(new CalendarSettings("Redbridge Collections", "Household waste & recycling (scraped)", LONDON)),
                new DayResolver(LONDON),
                diagnostics,
                clock
        );
        apiServer.start();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + apiServer.actualPort() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        assertEquals(200, response.statusCode(), response.body());
        return JsonUtils.objectMapper().readTree(response.body());
    }

    private static void assertError(HttpResponse<String> response, int status, String code) throws Exception {
        assertEquals(status, response.statusCode(), response.body());
        assertEquals(code, JsonUtils.objectMapper().readTree(response.body()).get("error").asText());
    }

    private static CollectionEvent event(String localDateTime, WasteType type) {
        return new CollectionEvent(ZonedDateTime.of(LocalDateTime.parse(localDateTime), LONDON), type, List.of(), "");
    }
}
