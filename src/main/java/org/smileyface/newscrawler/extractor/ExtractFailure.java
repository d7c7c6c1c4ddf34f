package org.smileyface.newscrawler.extractor;

/**
 * Why a reference did not produce an article. None of these is fatal to the walk.
 */
public record ExtractFailure(Kind kind, String url, String message) {

    public enum Kind {
        /** Page could not be loaded in time or returned an error status. */
        FETCH_FAILED,
        /** The final url (after redirects) belongs to an excluded vertical. */
        EXCLUDED,
        /** The page lacks the article presence marker. */
        NOT_AN_ARTICLE
    }
}
