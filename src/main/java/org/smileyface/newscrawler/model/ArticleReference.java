package org.smileyface.newscrawler.model;

/**
 * A candidate article link found on a daily listing page. Not persisted on its own.
 */
public record ArticleReference(String url, String sourceId) {

    public ArticleReference {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
    }
}
