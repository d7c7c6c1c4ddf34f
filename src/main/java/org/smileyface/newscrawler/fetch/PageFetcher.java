package org.smileyface.newscrawler.fetch;

/**
 * Loads a page and returns its DOM. Every call is bounded by the given timeout.
 */
public interface PageFetcher {

    /**
     * @param url       absolute http(s) url
     * @param timeoutMs upper bound for connecting and reading the whole response
     * @return the parsed page after following redirects
     * @throws PageFetchException when the page could not be loaded in time or answered with an error status
     */
    FetchedPage fetch(String url, int timeoutMs) throws PageFetchException;
}
