package org.smileyface.newscrawler.model;

/**
 * Lifecycle state of the crawl orchestrator.
 */
public enum CrawlRunState {
    NEW,
    RUNNING,
    COMPLETED,
    CANCELLED,
    ERROR
}
