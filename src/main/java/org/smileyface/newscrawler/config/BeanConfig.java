package org.smileyface.newscrawler.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.DedupIndex;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.crawler.InMemoryDedupIndex;
import org.smileyface.newscrawler.crawler.RedisDedupIndex;
import org.smileyface.newscrawler.elasticsearch.ElasticContext;
import org.smileyface.newscrawler.elasticsearch.ElasticRestClient;
import org.smileyface.newscrawler.extractor.ArticleExtractor;
import org.smileyface.newscrawler.extractor.PublishedAtNormalizer;
import org.smileyface.newscrawler.fetch.JsoupPageFetcher;
import org.smileyface.newscrawler.fetch.PageFetcher;
import org.smileyface.newscrawler.listing.ListingWalker;
import org.smileyface.newscrawler.sink.ArticleSink;
import org.smileyface.newscrawler.sink.CsvArticleSink;
import org.smileyface.newscrawler.sink.ElasticArticleSink;
import org.smileyface.newscrawler.sink.JdbcArticleSink;
import org.smileyface.newscrawler.sink.SinkException;
import org.smileyface.newscrawler.util.CrawlerUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the crawl pipeline: fetcher, walker, extractor, the configured sink and dedup index.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger();

    @Value("${crawler.time-zone:Asia/Seoul}")
    private String timeZone;

    /** Clock that decides which day "today" is for the backward walk. */
    @Bean
    public Clock crawlClock() {
        return Clock.system(ZoneId.of(timeZone));
    }

    @Bean
    public PageFetcher pageFetcher(CrawlerProperties properties) {
        return new JsoupPageFetcher(properties.getUserAgent());
    }

    @Bean
    public ExcludedUrlFilter excludedUrlFilter(CrawlerProperties properties) {
        return ExcludedUrlFilter.from(properties);
    }

    @Bean
    public PublishedAtNormalizer publishedAtNormalizer() {
        return new PublishedAtNormalizer();
    }

    @Bean
    public ListingWalker listingWalker(PageFetcher fetcher, CrawlerProperties properties, ExcludedUrlFilter filter) {
        return new ListingWalker(fetcher, properties, filter);
    }

    @Bean
    public ArticleExtractor articleExtractor(PageFetcher fetcher, CrawlerProperties properties,
                                             ExcludedUrlFilter filter, PublishedAtNormalizer normalizer) {
        return new ArticleExtractor(fetcher, properties, filter, normalizer);
    }

    /**
     * Selects the ArticleSink implementation based on {@code crawler.sink.type}. Supported values:
     * - "csv" (default): {@link CsvArticleSink} on {@code crawler.sink.csv-path}
     * - "jdbc": {@link JdbcArticleSink} on the application DataSource
     * - "elasticsearch": {@link ElasticArticleSink} on the index {@code indexPrefix-tenant}
     */
    @Bean
    @DependsOnDatabaseInitialization
    public ArticleSink articleSink(CrawlerProperties properties,
                                   ObjectProvider<DataSource> dataSourceProvider,
                                   ElasticContext elasticContext) {
        CrawlerProperties.SinkConfig sink = properties.getSink();
        String kind = sink.getType() == null ? "csv" : sink.getType().trim().toLowerCase();
        switch (kind) {
            case "jdbc": {
                DataSource ds = dataSourceProvider.getIfAvailable();
                if (ds == null) {
                    throw new IllegalStateException("crawler.sink.type=jdbc requires a DataSource");
                }
                log.info("Article sink: jdbc");
                return new JdbcArticleSink(ds, sink.getQueryTimeoutSeconds());
            }
            case "elasticsearch": {
                String index = CrawlerUtils.getIndexName(properties, elasticContext);
                if (index == null) {
                    throw new IllegalStateException("crawler.sink.index-prefix is required for the elasticsearch sink");
                }
                log.info("Article sink: elasticsearch index={} ({})", index, elasticContext);
                return new ElasticArticleSink(new ElasticRestClient(elasticContext), index);
            }
            case "csv":
                log.info("Article sink: csv {}", sink.getCsvPath());
                return new CsvArticleSink(Path.of(sink.getCsvPath()));
            default:
                throw new IllegalStateException("Unknown crawler.sink.type: " + sink.getType());
        }
    }

    /**
     * Selects the DedupIndex implementation based on {@code crawler.dedup.type}. Supported values:
     * - "memory" (default): {@link InMemoryDedupIndex} seeded from the urls already stored in the sink
     * - "redis": {@link RedisDedupIndex} when a {@link StringRedisTemplate} is available;
     *   falls back to the in-memory index otherwise.
     */
    @Bean
    @DependsOnDatabaseInitialization
    public DedupIndex dedupIndex(ObjectProvider<StringRedisTemplate> redisProvider,
                                 CrawlerProperties properties,
                                 ArticleSink sink) {
        String kind = properties.getDedup().getType() == null ? "memory" : properties.getDedup().getType().trim().toLowerCase();
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                log.info("Dedup index: redis namespace={}", properties.getDedup().getNamespace());
                return new RedisDedupIndex(template, properties);
            }
            log.warn("crawler.dedup.type=redis but no StringRedisTemplate is available; using the in-memory index");
        }
        try {
            return new InMemoryDedupIndex(sink.loadStoredUrls());
        } catch (SinkException e) {
            // starting empty would re-ingest everything already stored
            throw new IllegalStateException("Cannot seed dedup index from the article sink", e);
        }
    }
}
