package org.smileyface.newscrawler.enrichment;

import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.sink.SinkException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Stored articles whose enrichment fields can be completed after the crawl.
 * <p>
 * Window bounds are inclusive publication dates and may be null for an open bound. Records whose
 * publication time is not canonical are only returned when both bounds are null.
 */
public interface EnrichableArticleStore {

    List<ArticleRecord> findMissingIndustry(LocalDate from, LocalDate to) throws SinkException;

    /**
     * Records that have one of the given industries but no sentiment score yet.
     */
    List<ArticleRecord> findMissingSentiment(Collection<String> industries, LocalDate from, LocalDate to) throws SinkException;

    /**
     * Writes the industry and sentiment fields of the given records, matched by url. Null values leave the
     * stored value untouched.
     *
     * @return number of stored records that were updated
     */
    int updateEnrichment(List<ArticleRecord> records) throws SinkException;
}
