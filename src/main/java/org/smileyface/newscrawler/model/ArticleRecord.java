package org.smileyface.newscrawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.newscrawler.util.CrawlerUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A successfully extracted news article, handed to an {@code ArticleSink} for persistence.
 * The two enrichment fields ({@link #industry}, {@link #sentimentScore}) start empty and are
 * filled later by the enrichment stage; the crawl never waits for them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleRecord {

    public static final DateTimeFormatter CANONICAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private String id;                 // SHA-256 of the url
    private String url;                // unique key, same as the listing reference
    private String publishedAt;        // canonical "yyyy-MM-dd HH:mm:ss" or the raw scraped value
    private String title;
    private String body;
    private String sourceId;
    private Long crawlTimestamp;       // epoch millis

    // Enrichment
    private String industry;
    private Double sentimentScore;

    public ArticleRecord() {
        // for JSON mapping
    }

    public ArticleRecord(String url, String publishedAt, String title, String body, String sourceId) {
        setUrl(url);
        this.publishedAt = publishedAt;
        this.title = title;
        this.body = body;
        this.sourceId = sourceId;
        this.crawlTimestamp = System.currentTimeMillis();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUrl() { return url; }
    public void setUrl(String url) {
        this.url = url;
        this.id = url == null ? null : CrawlerUtils.sha256Hex(url);
    }

    public String getPublishedAt() { return publishedAt; }
    public void setPublishedAt(String publishedAt) { this.publishedAt = publishedAt; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    public String getSourceId() { return sourceId; }
    public void setSourceId(String sourceId) { this.sourceId = sourceId; }

    public Long getCrawlTimestamp() { return crawlTimestamp; }
    public void setCrawlTimestamp(Long crawlTimestamp) { this.crawlTimestamp = crawlTimestamp; }

    public String getIndustry() { return industry; }
    public void setIndustry(String industry) { this.industry = industry; }

    public Double getSentimentScore() { return sentimentScore; }
    public void setSentimentScore(Double sentimentScore) { this.sentimentScore = sentimentScore; }

    /**
     * Returns the publication time when {@link #publishedAt} is in canonical form, or null when
     * the value was preserved raw (or is a sentinel).
     */
    @JsonIgnore
    public LocalDateTime getPublishedDateTime() {
        if (publishedAt == null) return null;
        try {
            return LocalDateTime.parse(publishedAt, CANONICAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArticleRecord that = (ArticleRecord) o;
        return Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return "ArticleRecord{" +
                "url='" + url + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", publishedAt='" + publishedAt + '\'' +
                ", title='" + title + '\'' +
                ", bodyLength=" + (body != null ? body.length() : 0) +
                ", industry='" + industry + '\'' +
                ", sentimentScore=" + sentimentScore +
                '}';
    }
}
