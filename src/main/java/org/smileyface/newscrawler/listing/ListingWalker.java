package org.smileyface.newscrawler.listing;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.fetch.FetchedPage;
import org.smileyface.newscrawler.fetch.PageFetchException;
import org.smileyface.newscrawler.fetch.PageFetcher;
import org.smileyface.newscrawler.model.ArticleReference;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the paginated daily listing of a source and turns one page into article references.
 * An unreachable page or a page without the listing container is reported as unavailable, never thrown.
 */
public class ListingWalker {

    private static final Logger log = LoggerFactory.getLogger(ListingWalker.class);

    static final DateTimeFormatter LISTING_DATE = DateTimeFormatter.BASIC_ISO_DATE; // yyyyMMdd

    private final PageFetcher fetcher;
    private final CrawlerProperties.ListingConfig config;
    private final ExcludedUrlFilter excludedUrlFilter;
    private final int timeoutMs;

    public ListingWalker(PageFetcher fetcher, CrawlerProperties properties, ExcludedUrlFilter excludedUrlFilter) {
        this.fetcher = fetcher;
        this.config = properties.getListing();
        this.excludedUrlFilter = excludedUrlFilter;
        this.timeoutMs = properties.getListingTimeoutMs();
    }

    /**
     * @param sourceId   source identifier used in the listing url
     * @param date       listing date
     * @param pageNumber 1-based page number
     */
    public ListingPage listPage(String sourceId, LocalDate date, int pageNumber) {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1: " + pageNumber);
        }
        String url = listingUrl(sourceId, date, pageNumber);

        FetchedPage page;
        try {
            page = fetcher.fetch(url, timeoutMs);
        } catch (PageFetchException e) {
            log.warn("Listing unavailable source={} date={} page={}: {}", sourceId, date, pageNumber, e.getMessage());
            return ListingPage.unavailable();
        }
        Document doc = page.document();

        String container = config.getContainerSelector();
        if (container != null && !container.isBlank() && doc.selectFirst(container) == null) {
            log.debug("Listing container missing source={} date={} page={}", sourceId, date, pageNumber);
            return ListingPage.unavailable();
        }

        // end of listing is decided on the raw links; a page of only excluded links still pages on
        Set<String> hrefs = referenceUrls(doc);
        if (hrefs.isEmpty()) {
            return new ListingPage(List.of(), false, true);
        }
        List<ArticleReference> references = new ArrayList<>();
        for (String href : hrefs) {
            if (excludedUrlFilter.isExcluded(href)) {
                log.debug("Excluded listing reference {}", href);
                continue;
            }
            references.add(new ArticleReference(href, sourceId));
        }

        boolean hasNext = hasNextPage(doc, pageNumber);
        log.debug("Listing source={} date={} page={} references={} hasNext={}",
                sourceId, date, pageNumber, references.size(), hasNext);
        return new ListingPage(references, hasNext, true);
    }

    String listingUrl(String sourceId, LocalDate date, int pageNumber) {
        return config.getUrlTemplate()
                .replace("{sourceId}", sourceId)
                .replace("{date}", LISTING_DATE.format(date))
                .replace("{page}", Integer.toString(pageNumber));
    }

    // Grouped selector keeps document order across the configured selectors.
    private Set<String> referenceUrls(Document doc) {
        Set<String> urls = new LinkedHashSet<>();
        List<String> selectors = config.getReferenceSelectors();
        if (selectors.isEmpty()) return urls;
        for (Element a : doc.select(String.join(", ", selectors))) {
            String href = a.absUrl("href");
            if (href.isBlank()) href = a.attr("href").trim();
            if (!href.isBlank()) urls.add(href);
        }
        return urls;
    }

    private boolean hasNextPage(Document doc, int pageNumber) {
        Element paging = doc.selectFirst(config.getPagingSelector());
        if (paging == null) return false;
        String next = Integer.toString(pageNumber + 1);
        for (Element a : paging.select("a")) {
            if (next.equals(a.text().trim())) return true;
        }
        String nextGroup = config.getNextGroupSelector();
        return nextGroup != null && !nextGroup.isBlank() && paging.selectFirst(nextGroup) != null;
    }
}
