package com.binday.service;

import com.binday.core.calendar.CalendarSettings;
import com.binday.core.calendar.IcsCalendarBuilder;
import com.binday.core.schedule.DayResolver;
import com.binday.scraper.config.ScraperConfig;
import com.binday.scraper.council.CouncilScheduleScraper;
import com.binday.service.api.ApiServer;
import com.binday.service.api.ScrapeDiagnostics;
import com.binday.service.cache.CollectionCache;
import com.binday.service.config.ConfigLoader;
import com.binday.service.config.ServiceConfig;
import com.binday.service.http.HttpClientFactory;
import com.binday.service.runtime.CollectionService;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of("config");
        ServiceConfig config = ConfigLoader.load(configDir, System.getenv());
        ScraperConfig scraperConfig = config.scraper();
        Clock clock = Clock.systemUTC();

        CouncilScheduleScraper scraper = new CouncilScheduleScraper(
                scraperConfig,
                HttpClientFactory.scrapeClients(scraperConfig.requestTimeout())
        );
        ScrapeDiagnostics diagnostics = new ScrapeDiagnostics(clock);
        CollectionService collectionService = new CollectionService(
                scraper,
                new CollectionCache(clock),
                config.cacheTtl(),
                scraperConfig.requestTimeout(),
                clock,
                diagnostics
        );
        IcsCalendarBuilder calendarBuilder = new IcsCalendarBuilder(new CalendarSettings(
                config.calendarName(),
                config.calendarDescription(),
                scraperConfig.zone()
        ));

        ApiServer apiServer = new ApiServer(
                config.listenPort(),
                collectionService,
                calendarBuilder,
                new DayResolver(scraperConfig.zone()),
                diagnostics,
                clock
        );
        apiServer.start();
        LOGGER.info("Serving collections for UPRN " + scraperConfig.uprn() + " from " + scraperConfig.baseUrl()
                + scraperConfig.schedulePath() + " (cache TTL " + config.cacheTtl() + ")");

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            collectionService.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }
}
