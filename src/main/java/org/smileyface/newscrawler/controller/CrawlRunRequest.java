package org.smileyface.newscrawler.controller;

import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.CrawlMode;

import java.util.List;

/**
 * Optional overrides for an operator-triggered run. Absent fields fall back to the crawler configuration.
 * Dates are ISO strings (yyyy-MM-dd).
 */
public record CrawlRunRequest(CrawlMode mode,
                              String floorDate,
                              String startDate,
                              List<CrawlerProperties.SourceConfig> sources) {
}
