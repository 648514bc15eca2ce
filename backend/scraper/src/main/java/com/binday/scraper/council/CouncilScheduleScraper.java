package com.binday.scraper.council;

import com.binday.core.model.CollectionEvent;
import com.binday.scraper.api.ScheduleSource;
import com.binday.scraper.api.ScrapeContext;
import com.binday.scraper.config.ScraperConfig;
import com.binday.scraper.config.StreamRule;
import com.binday.scraper.config.StreamRules;

import java.net.CookieHandler;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.http.HttpClient;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Full scrape cycle against the council site: address handshake, schedule download, extraction and
 * normalization. Each call uses a fresh cookie jar so sessions never leak between cycles.
 */
public class CouncilScheduleScraper implements ScheduleSource {
    private final ScraperConfig config;
    private final Function<CookieHandler, HttpClient> clientFactory;
    private final SessionAcquirer sessionAcquirer;
    private final ScheduleFetcher scheduleFetcher;
    private final StreamExtractor extractor;
    private final ScheduleNormalizer normalizer;

    public CouncilScheduleScraper(ScraperConfig config) {
        this(config, cookies -> HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .cookieHandler(cookies)
                .build());
    }

    public CouncilScheduleScraper(ScraperConfig config, Function<CookieHandler, HttpClient> clientFactory) {
        this(config, clientFactory, StreamRules.DEFAULT);
    }

    public CouncilScheduleScraper(
            ScraperConfig config,
            Function<CookieHandler, HttpClient> clientFactory,
            List<StreamRule> rules
    ) {
        this.config = config;
        this.clientFactory = clientFactory;
        this.sessionAcquirer = new SessionAcquirer(config);
        this.scheduleFetcher = new ScheduleFetcher(config);
        this.extractor = new StreamExtractor(config.baseUrl(), rules);
        this.normalizer = new ScheduleNormalizer(config.zone(), config.startHour());
    }

    @Override
    public List<CollectionEvent> fetchCollections(ScrapeContext ctx) {
        CookieManager cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        ScrapeSession session = new ScrapeSession(clientFactory.apply(cookies), cookies);

        sessionAcquirer.acquire(ctx, session);
        byte[] body = scheduleFetcher.fetch(ctx, session);
        List<StreamHarvest> harvests = extractor.extract(body);
        List<CollectionEvent> events = normalizer.normalize(harvests, LocalDate.now(ctx.clock().withZone(config.zone())));

        // a scrape cancelled while parsing must not hand back a result
        ctx.checkActive();
        return events;
    }
}
