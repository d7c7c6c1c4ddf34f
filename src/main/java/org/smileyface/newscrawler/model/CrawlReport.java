package org.smileyface.newscrawler.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Summary of one orchestrator run.
 *
 * @param lastCursor the last date that was walked, or null when no date was walked
 */
public record CrawlReport(CrawlMode mode,
                          LocalDate startDate,
                          LocalDate floorDate,
                          LocalDate lastCursor,
                          TerminationReason termination,
                          List<SourceReport> sources,
                          Instant startedAt,
                          Instant finishedAt) {

    public CrawlReport {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public int totalInserted() {
        return sources.stream().mapToInt(SourceReport::getInsertedCount).sum();
    }
}
