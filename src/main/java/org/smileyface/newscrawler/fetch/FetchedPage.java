package org.smileyface.newscrawler.fetch;

import org.jsoup.nodes.Document;

/**
 * A parsed HTML page.
 *
 * @param requestedUrl url that was asked for
 * @param resolvedUrl  final url after redirects
 * @param httpStatus   status of the final response
 * @param document     parsed DOM, with the resolved url as base uri
 */
public record FetchedPage(String requestedUrl, String resolvedUrl, int httpStatus, Document document) {
}
