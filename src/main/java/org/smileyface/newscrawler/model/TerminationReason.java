package org.smileyface.newscrawler.model;

/**
 * Why a whole crawl run ended.
 */
public enum TerminationReason {
    ALL_SOURCES_RETIRED,
    FLOOR_DATE_CROSSED,
    CANCELLED
}
