package org.smileyface.newscrawler.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.sink.ArticleSink;
import org.smileyface.newscrawler.sink.SinkException;
import org.smileyface.newscrawler.util.CrawlerUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Completes the enrichment fields of stored articles after the crawl: industry from the headline, then a
 * sentiment score for articles of the configured target industries.
 * <p>
 * Each stage is skipped with a warning when its model or an enrichable store is not available. Work is
 * done and saved batch by batch, so an interrupted stage resumes where it left off.
 */
@Service
public class ArticleEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(ArticleEnrichmentService.class);

    private final EnrichableArticleStore store;
    private final IndustryClassifier classifier;
    private final SentimentScorer scorer;
    private final CrawlerProperties.EnrichmentConfig config;

    @Autowired
    public ArticleEnrichmentService(ArticleSink sink,
                                    ObjectProvider<IndustryClassifier> classifierProvider,
                                    ObjectProvider<SentimentScorer> scorerProvider,
                                    CrawlerProperties properties) {
        this(sink instanceof EnrichableArticleStore ? (EnrichableArticleStore) sink : null,
                classifierProvider.getIfAvailable(),
                scorerProvider.getIfAvailable(),
                properties.getEnrichment());
    }

    public ArticleEnrichmentService(EnrichableArticleStore store,
                                    IndustryClassifier classifier,
                                    SentimentScorer scorer,
                                    CrawlerProperties.EnrichmentConfig config) {
        this.store = store;
        this.classifier = classifier;
        this.scorer = scorer;
        this.config = config;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * Labels every stored article without an industry whose publication date lies in the window.
     *
     * @return number of updated articles
     */
    public int fillMissingIndustry(LocalDate from, LocalDate to) throws SinkException {
        if (store == null || classifier == null) {
            log.warn("Industry enrichment skipped: store={} classifier={}", store != null, classifier != null);
            return 0;
        }
        List<ArticleRecord> pending = store.findMissingIndustry(from, to);
        log.info("Industry enrichment: {} articles pending (window {}..{})", pending.size(), from, to);

        int updated = 0;
        for (List<ArticleRecord> batch : batches(pending)) {
            List<String> titles = new ArrayList<>(batch.size());
            for (ArticleRecord r : batch) {
                titles.add(r.getTitle() == null ? "" : r.getTitle());
            }
            List<IndustryLabel> labels = classifier.classify(titles);
            if (labels == null || labels.size() != batch.size()) {
                log.error("Classifier returned {} labels for {} titles; batch skipped",
                        labels == null ? 0 : labels.size(), batch.size());
                continue;
            }
            for (int i = 0; i < batch.size(); i++) {
                batch.get(i).setIndustry(labels.get(i).label());
            }
            updated += store.updateEnrichment(batch);
        }
        log.info("Industry enrichment done: {} articles updated", updated);
        return updated;
    }

    /**
     * Scores every stored article of a target industry that has no sentiment yet. The scored text is the
     * headline followed by the leading characters of the body.
     *
     * @return number of updated articles
     */
    public int fillMissingSentiment(LocalDate from, LocalDate to) throws SinkException {
        if (store == null || scorer == null) {
            log.warn("Sentiment enrichment skipped: store={} scorer={}", store != null, scorer != null);
            return 0;
        }
        List<ArticleRecord> pending = store.findMissingSentiment(config.getSentimentIndustries(), from, to);
        log.info("Sentiment enrichment: {} articles pending for industries {}", pending.size(), config.getSentimentIndustries());

        int updated = 0;
        for (List<ArticleRecord> batch : batches(pending)) {
            List<String> texts = new ArrayList<>(batch.size());
            for (ArticleRecord r : batch) {
                texts.add(sentimentText(r));
            }
            List<Double> scores = scorer.score(texts);
            if (scores == null || scores.size() != batch.size()) {
                log.error("Scorer returned {} scores for {} texts; batch skipped",
                        scores == null ? 0 : scores.size(), batch.size());
                continue;
            }
            for (int i = 0; i < batch.size(); i++) {
                batch.get(i).setSentimentScore(scores.get(i));
            }
            updated += store.updateEnrichment(batch);
        }
        log.info("Sentiment enrichment done: {} articles updated", updated);
        return updated;
    }

    String sentimentText(ArticleRecord r) {
        String title = r.getTitle() == null ? "" : r.getTitle();
        return title + " " + CrawlerUtils.head(r.getBody(), config.getSentimentBodyChars());
    }

    private List<List<ArticleRecord>> batches(List<ArticleRecord> all) {
        List<List<ArticleRecord>> out = new ArrayList<>();
        int size = config.getBatchSize();
        for (int i = 0; i < all.size(); i += size) {
            out.add(all.subList(i, Math.min(all.size(), i + size)));
        }
        return out;
    }
}
