package org.smileyface.newscrawler.sink;

/**
 * Result of a successful {@link ArticleSink#write} call.
 */
public enum SinkOutcome {
    /** The record was stored. */
    WRITTEN,
    /** The sink already held a record with the same url; nothing was changed. */
    DUPLICATE
}
