package org.smileyface.newscrawler;

import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.crawler.DedupIndex;
import org.smileyface.newscrawler.crawler.InMemoryDedupIndex;
import org.smileyface.newscrawler.model.CrawlRunState;
import org.smileyface.newscrawler.service.CrawlOrchestrator;
import org.smileyface.newscrawler.service.CrawlScheduler;
import org.smileyface.newscrawler.sink.ArticleSink;
import org.smileyface.newscrawler.sink.JdbcArticleSink;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class NewsCrawlerApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ArticleSink sink;

    @Autowired
    private DedupIndex dedupIndex;

    @Autowired
    private CrawlOrchestrator orchestrator;

    @Test
    void contextWiresConfiguredSinkAndIndex() {
        assertThat(sink).isInstanceOf(JdbcArticleSink.class);
        assertThat(dedupIndex).isInstanceOf(InMemoryDedupIndex.class);
        assertThat(orchestrator.getState()).isEqualTo(CrawlRunState.NEW);
        assertThat(context.getBeansOfType(CrawlScheduler.class)).isEmpty();
    }
}
