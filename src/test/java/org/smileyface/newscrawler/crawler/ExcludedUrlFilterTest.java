package org.smileyface.newscrawler.crawler;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExcludedUrlFilterTest {

    @Test
    void defaultPatternsExcludeEntertainmentAndSports() {
        ExcludedUrlFilter filter = ExcludedUrlFilter.from(new CrawlerProperties());

        assertThat(filter.isExcluded("https://entertain.naver.com/read?oid=009&aid=1")).isTrue();
        assertThat(filter.isExcluded("https://sports.news.naver.com/news?oid=009&aid=2")).isTrue();
        assertThat(filter.isExcluded("https://n.news.naver.com/mnews/article/009/0005")).isFalse();
        assertThat(filter.isExcluded(null)).isFalse();
    }

    @Test
    void invalidPatternIsIgnored() {
        ExcludedUrlFilter filter = new ExcludedUrlFilter(Arrays.asList("(unclosed", "/photo/", null));

        assertThat(filter.isExcluded("https://a/photo/1")).isTrue();
        assertThat(filter.isExcluded("https://a/(unclosed")).isFalse();
    }

    @Test
    void emptyPatternListExcludesNothing() {
        assertThat(new ExcludedUrlFilter(List.of()).isExcluded("https://entertain.naver.com/x")).isFalse();
    }
}
