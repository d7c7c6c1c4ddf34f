package org.smileyface.newscrawler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.enrichment.ArticleEnrichmentService;
import org.smileyface.newscrawler.model.CrawlReport;
import org.springframework.stereotype.Service;

/**
 * One pass of the news pipeline with the configured sources, mode and dates: crawl, then industry
 * enrichment, then sentiment enrichment. A failing step is logged and the next step still runs.
 */
@Service
public class NewsPipelineService {

    private static final Logger log = LoggerFactory.getLogger(NewsPipelineService.class);

    private final CrawlOrchestrator orchestrator;
    private final ArticleEnrichmentService enrichment;
    private final CrawlerProperties properties;

    public NewsPipelineService(CrawlOrchestrator orchestrator,
                               ArticleEnrichmentService enrichment,
                               CrawlerProperties properties) {
        this.orchestrator = orchestrator;
        this.enrichment = enrichment;
        this.properties = properties;
    }

    /**
     * @return the crawl report, or null when the crawl step failed
     */
    public CrawlReport runOnce() {
        CrawlReport report = null;
        try {
            report = orchestrator.run(properties.getSourceTargets(), properties.getMode(),
                    properties.getFloorDateValue(), properties.getStartDateValue());
        } catch (RuntimeException e) {
            log.error("Pipeline crawl step failed", e);
        }

        if (!enrichment.isEnabled()) {
            log.info("Enrichment disabled; pipeline pass finished after crawl");
            return report;
        }
        try {
            enrichment.fillMissingIndustry(null, null);
        } catch (Exception e) {
            log.error("Pipeline industry step failed", e);
        }
        try {
            enrichment.fillMissingSentiment(null, null);
        } catch (Exception e) {
            log.error("Pipeline sentiment step failed", e);
        }
        return report;
    }
}
