package org.smileyface.newscrawler.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDedupIndexTest {

    @Test
    void seededUrlsAreKnown() {
        InMemoryDedupIndex index = new InMemoryDedupIndex(List.of("https://a", "https://b", "https://a"));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.has("https://a")).isTrue();
        assertThat(index.has("https://b")).isTrue();
        assertThat(index.has("https://c")).isFalse();
    }

    @Test
    void nullSeedStartsEmpty() {
        assertThat(new InMemoryDedupIndex(null).size()).isZero();
    }
}
