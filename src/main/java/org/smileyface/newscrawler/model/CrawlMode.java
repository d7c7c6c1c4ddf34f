package org.smileyface.newscrawler.model;

/**
 * How a run treats references that are already ingested.
 */
public enum CrawlMode {
    /** Stop a source at the first already-ingested reference (its frontier). */
    INCREMENTAL,

    /** Skip already-ingested references and keep walking back until the floor date is crossed. */
    GAP_FILLING
}
