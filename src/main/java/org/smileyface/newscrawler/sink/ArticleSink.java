package org.smileyface.newscrawler.sink;

import org.smileyface.newscrawler.model.ArticleRecord;

import java.util.Set;

/**
 * Destination of extracted articles.
 */
public interface ArticleSink {

    /**
     * Stores one record. A record whose url is already stored is reported as
     * {@link SinkOutcome#DUPLICATE} instead of failing.
     *
     * @throws SinkException when the record could not be stored
     */
    SinkOutcome write(ArticleRecord record) throws SinkException;

    /**
     * All urls currently stored. Used to seed the in-memory dedup index at start-up.
     */
    Set<String> loadStoredUrls() throws SinkException;
}
