package org.smileyface.newscrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * {@link PageFetcher} over plain HTTP using jsoup. Redirects are followed so the resolved url can be
 * checked against excluded verticals.
 */
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final String userAgent;

    public JsoupPageFetcher(String userAgent) {
        this.userAgent = Objects.toString(userAgent, "SmileyfaceNewsCrawler/0.1");
    }

    @Override
    public FetchedPage fetch(String url, int timeoutMs) throws PageFetchException {
        int httpStatus;
        Document doc;
        String resolved;
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(Math.max(0, timeoutMs))
                    .followRedirects(true)
                    .ignoreHttpErrors(true);

            Connection.Response res = conn.execute();
            httpStatus = res.statusCode();
            resolved = res.url() != null ? res.url().toString() : url;
            if (httpStatus >= 400) {
                throw new PageFetchException(url, httpStatus, "HTTP " + httpStatus + " for " + url);
            }
            doc = res.parse();
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            log.debug("Failed to fetch {}: {}", url, e.getMessage());
            throw new PageFetchException(url, "Failed to fetch " + url + ": " + e.getMessage(), e);
        }
        return new FetchedPage(url, resolved, httpStatus, doc);
    }
}
