package org.smileyface.newscrawler.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-source totals accumulated over a whole run.
 */
public final class SourceReport {

    private final SourceTarget source;
    private int insertedCount;
    private int daysVisited;
    private int duplicateCount;
    private int skippedCount;
    private final List<String> sinkFailures = new ArrayList<>();
    private LocalDate retiredOn;
    private StopReason retiredReason;

    public SourceReport(SourceTarget source) {
        this.source = source;
    }

    public synchronized void add(LocalDate date, RunVerdict verdict) {
        daysVisited++;
        insertedCount += verdict.insertedCount();
        duplicateCount += verdict.duplicateCount();
        skippedCount += verdict.skippedCount();
        sinkFailures.addAll(verdict.sinkFailures());
        if (verdict.stopped()) {
            retiredOn = date;
            retiredReason = verdict.reason();
        }
    }

    public SourceTarget getSource() { return source; }
    public synchronized int getInsertedCount() { return insertedCount; }
    public synchronized int getDaysVisited() { return daysVisited; }
    public synchronized int getDuplicateCount() { return duplicateCount; }
    public synchronized int getSkippedCount() { return skippedCount; }
    public synchronized List<String> getSinkFailures() { return List.copyOf(sinkFailures); }
    public synchronized LocalDate getRetiredOn() { return retiredOn; }
    public synchronized StopReason getRetiredReason() { return retiredReason; }

    public synchronized boolean isRetired() {
        return retiredOn != null;
    }

    @Override
    public synchronized String toString() {
        return "SourceReport{" +
                "source=" + source +
                ", inserted=" + insertedCount +
                ", days=" + daysVisited +
                ", duplicates=" + duplicateCount +
                ", skipped=" + skippedCount +
                ", sinkFailures=" + sinkFailures.size() +
                ", retiredOn=" + retiredOn +
                ", reason=" + retiredReason +
                '}';
    }
}
