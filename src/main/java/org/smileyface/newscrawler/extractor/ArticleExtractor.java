package org.smileyface.newscrawler.extractor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.fetch.FetchedPage;
import org.smileyface.newscrawler.fetch.PageFetchException;
import org.smileyface.newscrawler.fetch.PageFetcher;
import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.model.ArticleReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Visits an article page and reads title, body and publication time.
 * <p>
 * Missing fields never fail the extraction: each one falls back to its configured sentinel. Only an
 * unreachable page, a redirect into an excluded vertical or a page that is not an article is reported
 * as an {@link ExtractFailure}.
 */
public class ArticleExtractor {

    private static final Logger log = LogManager.getLogger();

    private final PageFetcher fetcher;
    private final ExcludedUrlFilter excludedUrlFilter;
    private final PublishedAtNormalizer normalizer;
    private final int timeoutMs;
    private final String presenceSelector;

    private final FieldExtractionChain titleChain;
    private final FieldExtractionChain bodyChain;
    private final FieldExtractionChain dateChain;

    public ArticleExtractor(PageFetcher fetcher,
                            CrawlerProperties properties,
                            ExcludedUrlFilter excludedUrlFilter,
                            PublishedAtNormalizer normalizer) {
        this.fetcher = fetcher;
        this.excludedUrlFilter = excludedUrlFilter;
        this.normalizer = normalizer;
        this.timeoutMs = properties.getArticleTimeoutMs();

        CrawlerProperties.ArticleConfig article = properties.getArticle();
        CrawlerProperties.SentinelConfig sentinels = properties.getSentinels();
        this.presenceSelector = article.getPresenceSelector();
        this.titleChain = new FieldExtractionChain("title",
                List.of(new SelectorTextStrategy(article.getTitleSelector())),
                sentinels.getNoTitle());
        this.bodyChain = new FieldExtractionChain("body",
                List.of(new SelectorTextStrategy(article.getBodySelector(), article.getBodyStripSelectors())),
                sentinels.getNoBody());
        this.dateChain = new FieldExtractionChain("publishedAt",
                dateStrategies(article.getDateStrategies()),
                sentinels.getNoDate());
    }

    static List<FieldStrategy> dateStrategies(List<CrawlerProperties.DateStrategyConfig> configs) {
        List<FieldStrategy> out = new ArrayList<>();
        for (CrawlerProperties.DateStrategyConfig c : configs) {
            if (c == null || c.getSelector() == null || c.getSelector().isBlank()) continue;
            if (c.getAttribute() != null && !c.getAttribute().isBlank()) {
                out.add(new SelectorAttributeStrategy(c.getSelector(), c.getAttribute()));
            } else {
                out.add(new SelectorTextStrategy(c.getSelector()));
            }
        }
        return out;
    }

    public ExtractResult extract(ArticleReference reference) {
        return extract(reference.url(), reference.sourceId());
    }

    public ExtractResult extract(String url, String sourceId) {
        FetchedPage page;
        try {
            page = fetcher.fetch(url, timeoutMs);
        } catch (PageFetchException e) {
            log.warn("Article fetch failed url={}: {}", url, e.getMessage());
            return ExtractResult.failure(ExtractFailure.Kind.FETCH_FAILED, url, e.getMessage());
        }

        String resolved = page.resolvedUrl();
        if (excludedUrlFilter.isExcluded(resolved)) {
            log.debug("Article url={} resolved into excluded vertical {}", url, resolved);
            return ExtractResult.failure(ExtractFailure.Kind.EXCLUDED, url, "redirected to " + resolved);
        }

        Document doc = page.document();
        if (presenceSelector != null && !presenceSelector.isBlank() && doc.selectFirst(presenceSelector) == null) {
            log.debug("Not an article page url={}", url);
            return ExtractResult.failure(ExtractFailure.Kind.NOT_AN_ARTICLE, url, "presence marker missing");
        }

        FieldResult title = titleChain.apply(doc);
        FieldResult body = bodyChain.apply(doc);
        FieldResult date = dateChain.apply(doc);
        String publishedAt = date.isSentinel() ? date.value() : normalizer.normalize(date.value());

        if (log.isDebugEnabled()) {
            log.debug("Extracted url={} title={} body={} date={} ({})", url,
                    title.isSentinel() ? "sentinel" : "ok",
                    body.isSentinel() ? "sentinel" : "ok",
                    publishedAt, date.isSentinel() ? "sentinel" : date.strategy());
        }
        return ExtractResult.success(new ArticleRecord(url, publishedAt, title.value(), body.value(), sourceId));
    }
}
