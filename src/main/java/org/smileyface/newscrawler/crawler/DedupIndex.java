package org.smileyface.newscrawler.crawler;

/**
 * Durable set of article URLs that have already been ingested.
 * <p>
 * A URL is recorded only after the sink accepted the article, so a crash between the two leaves the
 * URL unrecorded and it is simply visited again on the next run. Entries are never removed.
 * Implementations must be safe for concurrent use by several source workers.
 */
public interface DedupIndex {

    /**
     * @param url article URL as found on the listing page
     * @return true when the URL has been ingested before
     */
    boolean has(String url);

    /**
     * Marks the URL as ingested. Recording the same URL twice has no further effect.
     * @param url article URL as found on the listing page
     */
    void record(String url);
}
