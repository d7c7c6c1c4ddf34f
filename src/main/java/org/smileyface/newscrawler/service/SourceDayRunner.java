package org.smileyface.newscrawler.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.DedupIndex;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.crawler.SessionCache;
import org.smileyface.newscrawler.extractor.ArticleExtractor;
import org.smileyface.newscrawler.extractor.ExtractResult;
import org.smileyface.newscrawler.listing.ListingPage;
import org.smileyface.newscrawler.listing.ListingWalker;
import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.model.ArticleReference;
import org.smileyface.newscrawler.model.CrawlMode;
import org.smileyface.newscrawler.model.RunVerdict;
import org.smileyface.newscrawler.model.SourceTarget;
import org.smileyface.newscrawler.model.StopReason;
import org.smileyface.newscrawler.sink.ArticleSink;
import org.smileyface.newscrawler.sink.SinkException;
import org.smileyface.newscrawler.sink.SinkOutcome;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Walks every listing page of one source for one date and ingests the articles found there.
 * <p>
 * In incremental mode the first already-ingested reference marks the frontier: the walk stops at once
 * and the source is retired. In gap-filling mode such references are skipped and the walk goes on.
 * A url is recorded in the dedup index only after the sink accepted its article.
 */
@Component
public class SourceDayRunner {

    private static final Logger log = LogManager.getLogger();

    private final ListingWalker walker;
    private final ArticleExtractor extractor;
    private final DedupIndex dedupIndex;
    private final ArticleSink sink;
    private final ExcludedUrlFilter excludedUrlFilter;
    private final long requestDelayMs;

    public SourceDayRunner(ListingWalker walker,
                           ArticleExtractor extractor,
                           DedupIndex dedupIndex,
                           ArticleSink sink,
                           ExcludedUrlFilter excludedUrlFilter,
                           CrawlerProperties properties) {
        this.walker = walker;
        this.extractor = extractor;
        this.dedupIndex = dedupIndex;
        this.sink = sink;
        this.excludedUrlFilter = excludedUrlFilter;
        this.requestDelayMs = properties.getRequestDelayMs();
    }

    public RunVerdict runDay(SourceTarget source, LocalDate date, CrawlMode mode) {
        return runDay(source, date, mode, () -> Thread.currentThread().isInterrupted());
    }

    /**
     * @param cancelled polled between references; when it turns true the walk ends with {@link StopReason#CANCELLED}
     */
    public RunVerdict runDay(SourceTarget source, LocalDate date, CrawlMode mode, BooleanSupplier cancelled) {
        Walk walk = new Walk(source, date, mode);

        for (int page = 1; ; page++) {
            if (cancelled.getAsBoolean()) {
                return walk.verdict(false, StopReason.CANCELLED);
            }
            ListingPage listing = walker.listPage(source.sourceId(), date, page);
            if (!listing.available()) {
                if (page == 1) {
                    // an unreadable first page retires the source only when walking toward a frontier
                    log.warn("Listing unavailable source={} date={} mode={}", source, date, mode);
                    return RunVerdict.listingUnavailable(mode == CrawlMode.INCREMENTAL);
                }
                log.warn("Listing page {} unavailable source={} date={}; treating as end of listing", page, source, date);
                return walk.verdict(false, StopReason.EXHAUSTED);
            }

            for (ArticleReference ref : listing.references()) {
                if (cancelled.getAsBoolean()) {
                    return walk.verdict(false, StopReason.CANCELLED);
                }
                if (walk.visit(ref)) {
                    log.info("Frontier reached source={} date={} url={}", source, date, ref.url());
                    return walk.verdict(true, StopReason.FRONTIER_REACHED);
                }
            }

            if (!listing.hasNextPage()) {
                return walk.verdict(false, StopReason.EXHAUSTED);
            }
        }
    }

    private void pause() {
        if (requestDelayMs <= 0) return;
        try {
            Thread.sleep(requestDelayMs);
        } catch (InterruptedException e) {
            // re-assert; the cancellation check before the next reference picks it up
            Thread.currentThread().interrupt();
        }
    }

    /** Mutable state of one (source, date) walk. */
    private final class Walk {
        private final SourceTarget source;
        private final LocalDate date;
        private final CrawlMode mode;
        private final SessionCache session = new SessionCache();
        private final List<String> sinkFailures = new ArrayList<>();
        private int inserted;
        private int duplicates;
        private int skipped;
        private boolean visitedArticle;

        Walk(SourceTarget source, LocalDate date, CrawlMode mode) {
            this.source = source;
            this.date = date;
            this.mode = mode;
        }

        /**
         * @return true when the reference is the incremental frontier and the walk must stop
         */
        boolean visit(ArticleReference ref) {
            String url = ref.url();
            if (excludedUrlFilter.isExcluded(url)) {
                skipped++;
                return false;
            }
            if (session.contains(url)) {
                return false;
            }
            if (dedupIndex.has(url)) {
                duplicates++;
                if (mode == CrawlMode.INCREMENTAL) {
                    return true;
                }
                session.add(url);
                return false;
            }

            if (visitedArticle) pause();
            visitedArticle = true;

            ExtractResult result = extractor.extract(ref);
            if (!result.isSuccess()) {
                log.debug("Skipped source={} date={} url={} reason={}", source, date, url, result.getFailure().kind());
                skipped++;
                session.add(url);
                return false;
            }

            ArticleRecord record = result.getRecord();
            SinkOutcome outcome;
            try {
                outcome = sink.write(record);
            } catch (SinkException e) {
                log.error("Sink write failed source={} date={} url={}", source, date, url, e);
                sinkFailures.add(url);
                session.add(url);
                return false;
            }

            dedupIndex.record(url);
            session.add(url);
            if (outcome == SinkOutcome.WRITTEN) {
                inserted++;
            } else {
                duplicates++;
            }
            return false;
        }

        RunVerdict verdict(boolean stopped, StopReason reason) {
            RunVerdict v = new RunVerdict(stopped, inserted, reason, duplicates, skipped, sinkFailures);
            log.info("Day verdict source={} date={} mode={} stopped={} reason={} inserted={} duplicates={} skipped={} sinkFailures={}",
                    source, date, mode, stopped, reason, inserted, duplicates, skipped, sinkFailures.size());
            return v;
        }
    }
}
