package org.smileyface.newscrawler.model;

import java.util.List;

/**
 * Outcome of walking one source for one date.
 *
 * @param stopped        true when the source should be retired for the rest of the run
 * @param insertedCount  records newly written to the sink
 * @param reason         why the walk ended
 * @param duplicateCount already-ingested references skipped (gap-filling) or met (incremental)
 * @param skippedCount   references whose extraction failed or was excluded
 * @param sinkFailures   urls whose sink write failed; they are not recorded and will be retried
 */
public record RunVerdict(boolean stopped,
                         int insertedCount,
                         StopReason reason,
                         int duplicateCount,
                         int skippedCount,
                         List<String> sinkFailures) {

    public RunVerdict {
        sinkFailures = sinkFailures == null ? List.of() : List.copyOf(sinkFailures);
    }

    public static RunVerdict listingUnavailable(boolean retire) {
        return new RunVerdict(retire, 0, StopReason.LISTING_UNAVAILABLE, 0, 0, List.of());
    }

    public static RunVerdict error() {
        return new RunVerdict(true, 0, StopReason.ERROR, 0, 0, List.of());
    }
}
