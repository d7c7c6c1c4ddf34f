package org.smileyface.newscrawler.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.enrichment.EnrichableArticleStore;
import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.util.CrawlerUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stores articles in the relational table {@code news}, keyed by link.
 * <p>
 * A primary key violation means the article is already stored and is reported as
 * {@link SinkOutcome#DUPLICATE}. {@code ndate} holds the canonical publication time and is null when the
 * scraped value could not be normalised; the scraped value itself is always kept in {@code ndate_raw}.
 */
public class JdbcArticleSink implements ArticleSink, EnrichableArticleStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcArticleSink.class);

    // widths of the bounded text columns in schema.sql
    static final int TITLE_MAX = 2048;
    static final int NDATE_RAW_MAX = 512;

    private static final String INSERT = """
            INSERT INTO news (link, ndate, ndate_raw, title, content, oid, industry, sent_score, crawled_at)
            VALUES (:link, :ndate, :ndateRaw, :title, :content, :oid, :industry, :sentScore, :crawledAt)
            """;

    private static final String SELECT_COLUMNS =
            "SELECT link, ndate_raw, title, content, oid, industry, sent_score, crawled_at FROM news";

    private static final String UPDATE_ENRICHMENT = """
            UPDATE news
            SET industry = COALESCE(:industry, industry),
                sent_score = COALESCE(:sentScore, sent_score)
            WHERE link = :link
            """;

    private static final RowMapper<ArticleRecord> ROW_MAPPER = (rs, rowNum) -> {
        ArticleRecord r = new ArticleRecord();
        r.setUrl(rs.getString("link"));
        r.setPublishedAt(rs.getString("ndate_raw"));
        r.setTitle(rs.getString("title"));
        r.setBody(rs.getString("content"));
        r.setSourceId(rs.getString("oid"));
        r.setIndustry(rs.getString("industry"));
        double score = rs.getDouble("sent_score");
        r.setSentimentScore(rs.wasNull() ? null : score);
        Timestamp crawled = rs.getTimestamp("crawled_at");
        r.setCrawlTimestamp(crawled == null ? null : crawled.getTime());
        return r;
    };

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcArticleSink(DataSource dataSource, int queryTimeoutSeconds) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(Math.max(0, queryTimeoutSeconds));
        this.jdbc = new NamedParameterJdbcTemplate(template);
    }

    @Override
    public SinkOutcome write(ArticleRecord record) throws SinkException {
        LocalDateTime published = record.getPublishedDateTime();
        long crawled = record.getCrawlTimestamp() != null ? record.getCrawlTimestamp() : System.currentTimeMillis();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("link", record.getUrl())
                .addValue("ndate", published == null ? null : Timestamp.valueOf(published))
                .addValue("ndateRaw", truncate(record.getPublishedAt(), NDATE_RAW_MAX))
                .addValue("title", truncate(record.getTitle(), TITLE_MAX))
                .addValue("content", record.getBody())
                .addValue("oid", record.getSourceId())
                .addValue("industry", record.getIndustry())
                .addValue("sentScore", record.getSentimentScore())
                .addValue("crawledAt", Timestamp.from(Instant.ofEpochMilli(crawled)));
        try {
            jdbc.update(INSERT, params);
            return SinkOutcome.WRITTEN;
        } catch (DuplicateKeyException e) {
            log.debug("Duplicate link ignored: {}", record.getUrl());
            return SinkOutcome.DUPLICATE;
        } catch (DataAccessException e) {
            throw new SinkException("Failed to insert " + record.getUrl(), e);
        }
    }

    @Override
    public Set<String> loadStoredUrls() throws SinkException {
        try {
            return new HashSet<>(jdbc.getJdbcOperations().queryForList("SELECT link FROM news", String.class));
        } catch (DataAccessException e) {
            throw new SinkException("Failed to load stored links", e);
        }
    }

    @Override
    public List<ArticleRecord> findMissingIndustry(LocalDate from, LocalDate to) throws SinkException {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = SELECT_COLUMNS + " WHERE industry IS NULL" + windowClause(from, to, params) + " ORDER BY link";
        return query(sql, params);
    }

    @Override
    public List<ArticleRecord> findMissingSentiment(Collection<String> industries,
                                                    LocalDate from, LocalDate to) throws SinkException {
        if (industries == null || industries.isEmpty()) return List.of();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("industries", new ArrayList<>(industries));
        String sql = SELECT_COLUMNS + " WHERE sent_score IS NULL AND industry IN (:industries)"
                + windowClause(from, to, params) + " ORDER BY link";
        return query(sql, params);
    }

    @Override
    public int updateEnrichment(List<ArticleRecord> records) throws SinkException {
        if (records == null || records.isEmpty()) return 0;
        SqlParameterSource[] batch = new SqlParameterSource[records.size()];
        for (int i = 0; i < records.size(); i++) {
            ArticleRecord r = records.get(i);
            batch[i] = new MapSqlParameterSource()
                    .addValue("link", r.getUrl())
                    .addValue("industry", r.getIndustry(), Types.VARCHAR)
                    .addValue("sentScore", r.getSentimentScore(), Types.DOUBLE);
        }
        try {
            int updated = 0;
            for (int n : jdbc.batchUpdate(UPDATE_ENRICHMENT, batch)) {
                if (n > 0) updated += n;
            }
            log.info("Enrichment applied to {} rows", updated);
            return updated;
        } catch (DataAccessException e) {
            throw new SinkException("Failed to apply enrichment to " + records.size() + " rows", e);
        }
    }

    private List<ArticleRecord> query(String sql, MapSqlParameterSource params) throws SinkException {
        try {
            return jdbc.query(sql, params, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new SinkException("Failed to query news", e);
        }
    }

    private static String truncate(String value, int max) {
        return value == null ? null : CrawlerUtils.head(value, max);
    }

    private static String windowClause(LocalDate from, LocalDate to, MapSqlParameterSource params) {
        StringBuilder sb = new StringBuilder();
        if (from != null) {
            sb.append(" AND ndate >= :fromTs");
            params.addValue("fromTs", Timestamp.valueOf(from.atStartOfDay()));
        }
        if (to != null) {
            sb.append(" AND ndate < :toTs");
            params.addValue("toTs", Timestamp.valueOf(to.plusDays(1).atStartOfDay()));
        }
        return sb.toString();
    }
}
