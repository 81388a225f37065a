package com.ableclub.monitor.events.scrape;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.ScrapedEvent;
import com.ableclub.monitor.events.util.EventKeys;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the AbleClub event listing. Each listing page holds a
 * {@code .ableclub-cardgroup} of {@code .card} elements and a pager whose
 * "next" item is marked {@code disabled} on the last page.
 */
@Service
public class JsoupEventScraper implements EventScraper {
    private static final Logger log = LoggerFactory.getLogger(JsoupEventScraper.class);

    private final MonitorProperties.Scraper properties;

    public JsoupEventScraper(MonitorProperties properties) {
        this.properties = properties.getScraper();
    }

    @Override
    public List<ScrapedEvent> fetchCurrentEvents() {
        Map<String, ScrapedEvent> events = new LinkedHashMap<>();
        Set<String> visited = new LinkedHashSet<>();
        String url = properties.getEventsUrl();
        int maxPages = properties.getMaxPages();

        while (url != null && visited.size() < maxPages) {
            if (!visited.add(url)) {
                log.warn("Event listing pagination loops back to {}, stopping", url);
                break;
            }
            Document page = fetchPage(url);
            List<ScrapedEvent> pageEvents = parseEvents(page, url);
            for (ScrapedEvent event : pageEvents) {
                events.putIfAbsent(event.externalId(), event);
            }
            log.debug("Scraped {} event(s) from {}", pageEvents.size(), url);
            url = nextPageUrl(page);
        }
        if (url != null) {
            log.warn("Stopped event listing pagination after {} page(s)", visited.size());
        }
        log.info("Scraped {} event(s) across {} page(s)", events.size(), visited.size());
        return new ArrayList<>(events.values());
    }

    Document fetchPage(String url) {
        try {
            return Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getTimeoutSeconds() * 1000)
                .get();
        } catch (IOException e) {
            throw new ScrapeException("Failed to fetch event listing " + url + ": " + e.getMessage(), e);
        }
    }

    static List<ScrapedEvent> parseEvents(Document page, String url) {
        Element cardGroup = page.selectFirst(".ableclub-cardgroup");
        if (cardGroup == null) {
            throw new ScrapeException("Event listing " + url + " has no card group; page layout changed?");
        }
        List<ScrapedEvent> events = new ArrayList<>();
        for (Element card : cardGroup.select(".card")) {
            String title = text(card.selectFirst("h3.card-title"));
            if (title == null) {
                log.warn("Skipping event card without a title on {}", url);
                continue;
            }
            Elements dates = card.select("p.text-date time");
            String startDate = dates.isEmpty() ? null : text(dates.get(0));
            String endDate = dates.size() < 2 ? null : text(dates.get(1));
            String body = text(card.selectFirst(".card-text"));
            events.add(new ScrapedEvent(
                EventKeys.externalId(title, startDate),
                title,
                body,
                startDate,
                endDate
            ));
        }
        return events;
    }

    static String nextPageUrl(Document page) {
        Element next = page.selectFirst(".page-item.PagedList-skipToNext");
        if (next == null || next.hasClass("disabled")) {
            return null;
        }
        Element link = next.selectFirst("a[href]");
        if (link == null) {
            return null;
        }
        String absolute = link.absUrl("href");
        return absolute == null || absolute.isBlank() ? null : absolute;
    }

    private static String text(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.text();
        return value == null || value.isBlank() ? null : value.trim();
    }
}
