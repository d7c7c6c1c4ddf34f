package org.smileyface.newscrawler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the news pipeline periodically (every 10 minutes unless configured otherwise).
 * Active only with {@code crawler.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "crawler.schedule", name = "enabled", havingValue = "true")
public class CrawlScheduler {

    private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

    private final NewsPipelineService pipeline;
    private final CrawlOrchestrator orchestrator;

    public CrawlScheduler(NewsPipelineService pipeline, CrawlOrchestrator orchestrator) {
        this.pipeline = pipeline;
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${crawler.schedule.interval-ms:600000}",
            initialDelayString = "${crawler.schedule.initial-delay-ms:10000}")
    public void tick() {
        if (orchestrator.isRunning()) {
            log.info("Scheduled pipeline skipped: a crawl run is still in progress");
            return;
        }
        log.info("Scheduled pipeline pass starting");
        pipeline.runOnce();
    }
}
