package org.smileyface.newscrawler.fetch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.testutil.FakeNewsSite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.smileyface.newscrawler.testutil.FakeNewsSite.html;

class JsoupPageFetcherTest {

    private FakeNewsSite site;
    private final JsoupPageFetcher fetcher = new JsoupPageFetcher("test-agent");

    @BeforeEach
    void setUp() throws Exception {
        site = FakeNewsSite.start();
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    @Test
    void fetch_followsRedirectAndReportsResolvedUrl() throws Exception {
        site.page("/target", html("<p id='x'>ok</p>"));
        site.redirect("/short", "/target");

        FetchedPage page = fetcher.fetch(site.url("/short"), 3000);

        assertThat(page.requestedUrl()).isEqualTo(site.url("/short"));
        assertThat(page.resolvedUrl()).isEqualTo(site.url("/target"));
        assertThat(page.httpStatus()).isEqualTo(200);
        assertThat(page.document().selectFirst("#x").text()).isEqualTo("ok");
    }

    @Test
    void fetch_httpErrorCarriesStatus() {
        assertThatThrownBy(() -> fetcher.fetch(site.url("/missing"), 3000))
                .isInstanceOfSatisfying(PageFetchException.class, e -> {
                    assertThat(e.getHttpStatus()).isEqualTo(404);
                    assertThat(e.getUrl()).isEqualTo(site.url("/missing"));
                });
    }

    @Test
    void fetch_unreachableHostHasNoStatus() {
        String url = site.url("/gone");
        site.close();

        assertThatThrownBy(() -> fetcher.fetch(url, 1000))
                .isInstanceOfSatisfying(PageFetchException.class, e -> assertThat(e.getHttpStatus()).isEqualTo(-1));
    }
}
