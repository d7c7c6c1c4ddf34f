package org.smileyface.newscrawler.model;

/**
 * Why a (source, date) walk ended.
 */
public enum StopReason {
    /** All listing pages of the date were walked. */
    EXHAUSTED,

    /** An already-ingested reference was met in incremental mode. */
    FRONTIER_REACHED,

    /** The daily listing never rendered (no content, blocked or timed out). */
    LISTING_UNAVAILABLE,

    /** The run was cancelled while the walk was in progress. */
    CANCELLED,

    /** An unexpected error aborted the walk. */
    ERROR
}
