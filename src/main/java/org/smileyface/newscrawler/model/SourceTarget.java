package org.smileyface.newscrawler.model;

/**
 * A news source to crawl: a human readable name plus the identifier used in listing URLs.
 */
public record SourceTarget(String displayName, String sourceId) {

    public SourceTarget {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be null/blank");
        }
        sourceId = sourceId.trim();
        displayName = (displayName == null || displayName.isBlank()) ? sourceId : displayName.trim();
    }

    @Override
    public String toString() {
        return displayName + "(" + sourceId + ")";
    }
}
