package org.smileyface.newscrawler.crawler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.model.CrawlMode;
import org.smileyface.newscrawler.model.SourceTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the news crawler.
 * <p>
 * Defaults are loaded from the classpath resource {@code NewsCrawlerConfig.json} when present;
 * Spring then binds/overrides values from application properties under the {@code crawler} prefix.
 */
@ConfigurationProperties(prefix = "crawler")
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    static final String DEFAULTS_RESOURCE = "NewsCrawlerConfig.json";

    /** Sources crawled by a configured run. */
    private List<SourceConfig> sources = new ArrayList<>();

    private CrawlMode mode = CrawlMode.INCREMENTAL;

    /** ISO date (yyyy-MM-dd). Dates older than this end the run. Required for gap-filling. */
    private String floorDate;

    /** ISO date the backward walk starts at. Defaults to today. */
    private String startDate;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    /** Bounded wait for a daily listing page. */
    private int listingTimeoutMs = 8000;

    /** Bounded wait for an article page. */
    private int articleTimeoutMs = 5000;

    /** Pause between two article visits of the same source. */
    private long requestDelayMs = 300;

    /** Number of sources walked concurrently for one date. 1 means strictly sequential. */
    private int parallelism = 1;

    /** Upper bound for all sources of one date when running in parallel. */
    private long dayTimeoutMs = 30 * 60 * 1000L;

    /** Java regex patterns (find semantics) of content verticals that are never ingested. */
    private List<String> excludeUrlPatterns = new ArrayList<>(List.of(
            "entertain\\.naver\\.com",
            "sports\\.naver\\.com",
            "sports\\.news\\.naver\\.com"
    ));

    private ListingConfig listing = new ListingConfig();
    private ArticleConfig article = new ArticleConfig();
    private SentinelConfig sentinels = new SentinelConfig();
    private DedupConfig dedup = new DedupConfig();
    private SinkConfig sink = new SinkConfig();
    private EnrichmentConfig enrichment = new EnrichmentConfig();

    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                new ObjectMapper().readerForUpdating(this).readValue(in);
            }
        } catch (Exception e) {
            // keep built-in defaults; a broken defaults file must not prevent start-up
            log.error("Failed to load default crawler configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Typed view of {@link #sources}, in declaration order. Entries without a source id are dropped.
     */
    @JsonIgnore
    public List<SourceTarget> getSourceTargets() {
        List<SourceTarget> out = new ArrayList<>();
        if (sources == null) return out;
        for (SourceConfig s : sources) {
            if (s == null || s.getSourceId() == null || s.getSourceId().isBlank()) continue;
            out.add(new SourceTarget(s.getDisplayName(), s.getSourceId()));
        }
        return out;
    }

    @JsonIgnore
    public LocalDate getFloorDateValue() {
        return parseDate("floorDate", floorDate);
    }

    @JsonIgnore
    public LocalDate getStartDateValue() {
        return parseDate("startDate", startDate);
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("crawler." + name + " must be an ISO date (yyyy-MM-dd): " + value, e);
        }
    }

    public List<SourceConfig> getSources() { return sources; }
    public void setSources(List<SourceConfig> sources) {
        this.sources = sources != null ? sources : new ArrayList<>();
    }

    public CrawlMode getMode() { return mode; }
    public void setMode(CrawlMode mode) {
        this.mode = mode != null ? mode : CrawlMode.INCREMENTAL;
    }

    public String getFloorDate() { return floorDate; }
    public void setFloorDate(String floorDate) {
        this.floorDate = (floorDate == null || floorDate.isBlank()) ? null : floorDate.trim();
    }

    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) {
        this.startDate = (startDate == null || startDate.isBlank()) ? null : startDate.trim();
    }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getListingTimeoutMs() { return listingTimeoutMs; }
    public void setListingTimeoutMs(int listingTimeoutMs) { this.listingTimeoutMs = listingTimeoutMs; }

    public int getArticleTimeoutMs() { return articleTimeoutMs; }
    public void setArticleTimeoutMs(int articleTimeoutMs) { this.articleTimeoutMs = articleTimeoutMs; }

    public long getRequestDelayMs() { return requestDelayMs; }
    public void setRequestDelayMs(long requestDelayMs) { this.requestDelayMs = Math.max(0, requestDelayMs); }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = Math.max(1, parallelism); }

    public long getDayTimeoutMs() { return dayTimeoutMs; }
    public void setDayTimeoutMs(long dayTimeoutMs) { this.dayTimeoutMs = dayTimeoutMs; }

    public List<String> getExcludeUrlPatterns() { return excludeUrlPatterns; }
    public void setExcludeUrlPatterns(List<String> excludeUrlPatterns) {
        this.excludeUrlPatterns = excludeUrlPatterns != null ? excludeUrlPatterns : new ArrayList<>();
    }

    public ListingConfig getListing() { return listing; }
    public void setListing(ListingConfig listing) { this.listing = listing != null ? listing : new ListingConfig(); }

    public ArticleConfig getArticle() { return article; }
    public void setArticle(ArticleConfig article) { this.article = article != null ? article : new ArticleConfig(); }

    public SentinelConfig getSentinels() { return sentinels; }
    public void setSentinels(SentinelConfig sentinels) { this.sentinels = sentinels != null ? sentinels : new SentinelConfig(); }

    public DedupConfig getDedup() { return dedup; }
    public void setDedup(DedupConfig dedup) { this.dedup = dedup != null ? dedup : new DedupConfig(); }

    public SinkConfig getSink() { return sink; }
    public void setSink(SinkConfig sink) { this.sink = sink != null ? sink : new SinkConfig(); }

    public EnrichmentConfig getEnrichment() { return enrichment; }
    public void setEnrichment(EnrichmentConfig enrichment) {
        this.enrichment = enrichment != null ? enrichment : new EnrichmentConfig();
    }

    // --------- Nested config types ---------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceConfig {
        private String displayName;
        private String sourceId;

        public SourceConfig() {} // for JSON mapping

        public SourceConfig(String displayName, String sourceId) {
            this.displayName = displayName;
            this.sourceId = sourceId;
        }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getSourceId() { return sourceId; }
        public void setSourceId(String sourceId) { this.sourceId = sourceId; }
    }

    /**
     * Where and how daily listing pages are read.
     * The url template understands the placeholders {@code {sourceId}}, {@code {date}} (yyyyMMdd) and {@code {page}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListingConfig {
        private String urlTemplate = "https://news.naver.com/main/list.naver?mode=LPOD&mid=sec&oid={sourceId}&date={date}&page={page}";
        private String containerSelector = "#main_content > div.list_body";
        private List<String> referenceSelectors = new ArrayList<>(List.of(
                "#main_content > div.list_body.newsflash_body > ul.type06_headline > li dl > dt:not(.photo) > a",
                "#main_content > div.list_body.newsflash_body > ul.type06 > li dl > dt:not(.photo) > a"
        ));
        private String pagingSelector = "#main_content > div.paging";
        private String nextGroupSelector = "a.next";

        public String getUrlTemplate() { return urlTemplate; }
        public void setUrlTemplate(String urlTemplate) { this.urlTemplate = urlTemplate; }
        public String getContainerSelector() { return containerSelector; }
        public void setContainerSelector(String containerSelector) { this.containerSelector = containerSelector; }
        public List<String> getReferenceSelectors() { return referenceSelectors; }
        public void setReferenceSelectors(List<String> referenceSelectors) {
            this.referenceSelectors = referenceSelectors != null ? referenceSelectors : new ArrayList<>();
        }
        public String getPagingSelector() { return pagingSelector; }
        public void setPagingSelector(String pagingSelector) { this.pagingSelector = pagingSelector; }
        public String getNextGroupSelector() { return nextGroupSelector; }
        public void setNextGroupSelector(String nextGroupSelector) { this.nextGroupSelector = nextGroupSelector; }
    }

    /**
     * Selectors of an article page. {@code dateStrategies} are tried in declaration order.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArticleConfig {
        private String presenceSelector = "#title_area > span";
        private String titleSelector = "#title_area > span";
        private String bodySelector = "#dic_area";
        private List<String> bodyStripSelectors = new ArrayList<>(List.of(".img_desc", ".media_end_summary"));
        private List<DateStrategyConfig> dateStrategies = new ArrayList<>(List.of(
                new DateStrategyConfig(".media_end_head_info_datestamp .media_end_head_info_datestamp_time", null),
                new DateStrategyConfig(".media_end_head_info_datestamp span", null),
                new DateStrategyConfig(".t11", null),
                new DateStrategyConfig(".media_end_head_info_datestamp", "data-date-time")
        ));

        public String getPresenceSelector() { return presenceSelector; }
        public void setPresenceSelector(String presenceSelector) { this.presenceSelector = presenceSelector; }
        public String getTitleSelector() { return titleSelector; }
        public void setTitleSelector(String titleSelector) { this.titleSelector = titleSelector; }
        public String getBodySelector() { return bodySelector; }
        public void setBodySelector(String bodySelector) { this.bodySelector = bodySelector; }
        public List<String> getBodyStripSelectors() { return bodyStripSelectors; }
        public void setBodyStripSelectors(List<String> bodyStripSelectors) {
            this.bodyStripSelectors = bodyStripSelectors != null ? bodyStripSelectors : new ArrayList<>();
        }
        public List<DateStrategyConfig> getDateStrategies() { return dateStrategies; }
        public void setDateStrategies(List<DateStrategyConfig> dateStrategies) {
            this.dateStrategies = dateStrategies != null ? dateStrategies : new ArrayList<>();
        }
    }

    /**
     * One step of the publication date chain: the text of {@code selector}, or its
     * {@code attribute} value when an attribute is given.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DateStrategyConfig {
        private String selector;
        private String attribute;

        public DateStrategyConfig() {} // for JSON mapping

        public DateStrategyConfig(String selector, String attribute) {
            this.selector = selector;
            this.attribute = attribute;
        }

        public String getSelector() { return selector; }
        public void setSelector(String selector) { this.selector = selector; }
        public String getAttribute() { return attribute; }
        public void setAttribute(String attribute) { this.attribute = attribute; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SentinelConfig {
        private String noTitle = "제목 없음";
        private String noBody = "본문 없음";
        private String noDate = "날짜 없음";

        public String getNoTitle() { return noTitle; }
        public void setNoTitle(String noTitle) { this.noTitle = noTitle; }
        public String getNoBody() { return noBody; }
        public void setNoBody(String noBody) { this.noBody = noBody; }
        public String getNoDate() { return noDate; }
        public void setNoDate(String noDate) { this.noDate = noDate; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DedupConfig {
        /** "memory" (seeded from the sink) or "redis". */
        private String type = "memory";
        /** Key prefix of the Redis set. */
        private String namespace = "newscrawler";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? "newscrawler" : namespace;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SinkConfig {
        /** "csv", "jdbc" or "elasticsearch". */
        private String type = "csv";
        private String csvPath = "data/news_db.csv";
        /** Elasticsearch index prefix; the tenant id is appended. */
        private String indexPrefix = "news";
        private int queryTimeoutSeconds = 10;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCsvPath() { return csvPath; }
        public void setCsvPath(String csvPath) { this.csvPath = csvPath; }
        public String getIndexPrefix() { return indexPrefix; }
        public void setIndexPrefix(String indexPrefix) {
            this.indexPrefix = (indexPrefix == null || indexPrefix.isBlank()) ? null : indexPrefix;
        }
        public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnrichmentConfig {
        private boolean enabled = true;
        private int batchSize = 32;
        /** Only articles labelled with one of these industries get a sentiment score. */
        private List<String> sentimentIndustries = new ArrayList<>(List.of("자동차", "건설", "헬스케어"));
        /** Number of body characters appended to the title for sentiment scoring. */
        private int sentimentBodyChars = 200;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = Math.max(1, batchSize); }
        public List<String> getSentimentIndustries() { return sentimentIndustries; }
        public void setSentimentIndustries(List<String> sentimentIndustries) {
            this.sentimentIndustries = sentimentIndustries != null ? sentimentIndustries : new ArrayList<>();
        }
        public int getSentimentBodyChars() { return sentimentBodyChars; }
        public void setSentimentBodyChars(int sentimentBodyChars) { this.sentimentBodyChars = Math.max(0, sentimentBodyChars); }
    }
}
