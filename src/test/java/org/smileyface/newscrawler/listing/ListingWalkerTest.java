package org.smileyface.newscrawler.listing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.fetch.JsoupPageFetcher;
import org.smileyface.newscrawler.model.ArticleReference;
import org.smileyface.newscrawler.testutil.FakeNewsSite;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.smileyface.newscrawler.testutil.FakeNewsSite.html;

class ListingWalkerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 12, 15);

    private FakeNewsSite site;
    private CrawlerProperties props;
    private ListingWalker walker;

    @BeforeEach
    void setUp() throws Exception {
        site = FakeNewsSite.start();
        props = site.properties();
        walker = new ListingWalker(new JsoupPageFetcher("test-agent"), props, ExcludedUrlFilter.from(props));
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private static List<String> paths(String prefix, int n) {
        List<String> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) out.add(prefix + i);
        return out;
    }

    @Test
    void listingUrl_fillsPlaceholders() {
        assertThat(walker.listingUrl("009", DAY, 3))
                .isEqualTo(site.baseUrl() + "/list?oid=009&date=20251215&page=3");
    }

    @Test
    void listPage_returnsReferencesInPageOrderAcrossBothLists() {
        // 12 references: 10 land in the headline list, 2 in the regular list
        List<String> page = paths("/article/009/", 12);
        site.listing("009", DAY, List.of(page));

        ListingPage result = walker.listPage("009", DAY, 1);

        assertThat(result.available()).isTrue();
        assertThat(result.references()).extracting(ArticleReference::url)
                .containsExactlyElementsOf(page.stream().map(site::url).toList());
        assertThat(result.references()).allMatch(r -> r.sourceId().equals("009"));
        assertThat(result.hasNextPage()).isFalse();
    }

    @Test
    void listPage_followsPagingUntilLastPage() {
        site.listing("015", DAY, List.of(paths("/a/", 3), paths("/b/", 3), paths("/c/", 2)));

        assertThat(walker.listPage("015", DAY, 1).hasNextPage()).isTrue();
        assertThat(walker.listPage("015", DAY, 2).hasNextPage()).isTrue();
        ListingPage last = walker.listPage("015", DAY, 3);
        assertThat(last.hasNextPage()).isFalse();
        assertThat(last.references()).hasSize(2);
    }

    @Test
    void listPage_nextGroupControlMeansAnotherPage() {
        String base = "/list?oid=011&date=20251215&page=";
        site.page("/grouped", html(
                "<div id='main_content'><div class='list_body newsflash_body'>",
                "<ul class='type06_headline'><li><dl><dt><a href='/x/1'>a</a></dt></dl></li></ul>",
                "</div><div class='paging'><strong>10</strong><a class='next' href='" + base + "11'>다음</a></div></div>"));
        props.getListing().setUrlTemplate(site.baseUrl() + "/grouped?p={page}");
        walker = new ListingWalker(new JsoupPageFetcher("test-agent"), props, ExcludedUrlFilter.from(props));

        assertThat(walker.listPage("011", DAY, 10).hasNextPage()).isTrue();
    }

    @Test
    void listPage_zeroReferencesMeansNoNextPageEvenWithPagingLinks() {
        site.page("/empty", html(
                "<div id='main_content'><div class='list_body newsflash_body'><ul class='type06_headline'></ul></div>",
                "<div class='paging'><strong>1</strong><a href='?page=2'>2</a></div></div>"));
        props.getListing().setUrlTemplate(site.baseUrl() + "/empty?p={page}");
        walker = new ListingWalker(new JsoupPageFetcher("test-agent"), props, ExcludedUrlFilter.from(props));

        ListingPage result = walker.listPage("009", DAY, 1);
        assertThat(result.available()).isTrue();
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.hasNextPage()).isFalse();
    }

    @Test
    void listPage_dropsExcludedVerticals() {
        site.listing("009", DAY, List.of(List.of("/article/1", "/sports/2", "/article/3")));

        ListingPage result = walker.listPage("009", DAY, 1);

        assertThat(result.references()).extracting(ArticleReference::url)
                .containsExactly(site.url("/article/1"), site.url("/article/3"));
    }

    @Test
    void listPage_pageOfOnlyExcludedLinksStillPagesOn() {
        site.listing("009", DAY, List.of(List.of("/sports/1", "/sports/2"), List.of("/article/1")));

        ListingPage result = walker.listPage("009", DAY, 1);

        assertThat(result.available()).isTrue();
        assertThat(result.references()).isEmpty();
        assertThat(result.hasNextPage()).isTrue();
    }

    @Test
    void listPage_serverErrorIsUnavailable() {
        site.unavailable("009", DAY);

        ListingPage result = walker.listPage("009", DAY, 1);

        assertThat(result.available()).isFalse();
        assertThat(result.references()).isEmpty();
        assertThat(result.hasNextPage()).isFalse();
    }

    @Test
    void listPage_missingContainerIsUnavailable() {
        site.page("/maintenance", html("<p>점검 중</p>"));
        props.getListing().setUrlTemplate(site.baseUrl() + "/maintenance?p={page}");
        walker = new ListingWalker(new JsoupPageFetcher("test-agent"), props, ExcludedUrlFilter.from(props));

        assertThat(walker.listPage("009", DAY, 1).available()).isFalse();
    }

    @Test
    void listPage_rejectsPageNumbersBelowOne() {
        assertThatThrownBy(() -> walker.listPage("009", DAY, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
