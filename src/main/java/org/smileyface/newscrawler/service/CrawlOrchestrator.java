package org.smileyface.newscrawler.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.CrawlMode;
import org.smileyface.newscrawler.model.CrawlReport;
import org.smileyface.newscrawler.model.CrawlRunState;
import org.smileyface.newscrawler.model.RunVerdict;
import org.smileyface.newscrawler.model.SourceReport;
import org.smileyface.newscrawler.model.SourceTarget;
import org.smileyface.newscrawler.model.StopReason;
import org.smileyface.newscrawler.model.TerminationReason;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Drives the backward walk over dates for a set of sources.
 * <p>
 * Starting at the start date (today by default) the cursor moves one day back per iteration. Every
 * still-active source is walked for the cursor date; a source whose walk reports {@code stopped} is
 * retired for the rest of the run. The run ends when no source is active, when the cursor passes the
 * floor date, or when it is cancelled. Only one run may be in progress at a time.
 */
@Service
public class CrawlOrchestrator {

    private static final Logger log = LogManager.getLogger();

    private static final long TIMEOUT_GRACE_MS = 10_000;

    private final SourceDayRunner runner;
    private final Clock clock;
    private final int parallelism;
    private final long dayTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean cancelRequested;
    private volatile CrawlRunState state = CrawlRunState.NEW;
    private volatile CrawlReport lastReport;

    @Autowired
    public CrawlOrchestrator(SourceDayRunner runner, CrawlerProperties properties, Clock clock) {
        this(runner, clock, properties.getParallelism(), properties.getDayTimeoutMs());
    }

    public CrawlOrchestrator(SourceDayRunner runner, Clock clock, int parallelism, long dayTimeoutMs) {
        this.runner = runner;
        this.clock = clock;
        this.parallelism = Math.max(1, parallelism);
        this.dayTimeoutMs = dayTimeoutMs > 0 ? dayTimeoutMs : Long.MAX_VALUE / 2;
    }

    public CrawlReport run(List<SourceTarget> sources, CrawlMode mode, LocalDate floorDate) {
        return run(sources, mode, floorDate, null);
    }

    /**
     * @param sources   sources in the order they are walked for each date
     * @param mode      incremental or gap-filling
     * @param floorDate oldest date to walk; required for gap-filling, optional otherwise
     * @param startDate first date to walk; null means today
     * @throws IllegalArgumentException when gap-filling without a floor date
     * @throws IllegalStateException    when another run is in progress
     */
    public CrawlReport run(List<SourceTarget> sources, CrawlMode mode, LocalDate floorDate, LocalDate startDate) {
        if (sources == null) {
            throw new IllegalArgumentException("sources must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (mode == CrawlMode.GAP_FILLING && floorDate == null) {
            throw new IllegalArgumentException("GAP_FILLING requires a floor date");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A crawl run is already in progress");
        }
        cancelRequested = false;
        state = CrawlRunState.RUNNING;
        try {
            CrawlReport report = doRun(sources, mode, floorDate, startDate != null ? startDate : LocalDate.now(clock));
            lastReport = report;
            state = report.termination() == TerminationReason.CANCELLED ? CrawlRunState.CANCELLED : CrawlRunState.COMPLETED;
            return report;
        } catch (RuntimeException e) {
            state = CrawlRunState.ERROR;
            throw e;
        } finally {
            running.set(false);
        }
    }

    private CrawlReport doRun(List<SourceTarget> sources, CrawlMode mode, LocalDate floorDate, LocalDate startDate) {
        Instant startedAt = clock.instant();
        List<SourceTarget> active = new ArrayList<>(new LinkedHashSet<>(sources));
        Map<SourceTarget, SourceReport> reports = new LinkedHashMap<>();
        for (SourceTarget s : active) {
            reports.put(s, new SourceReport(s));
        }
        log.info("Crawl run started mode={} start={} floor={} sources={} parallelism={}",
                mode, startDate, floorDate, active, parallelism);

        LocalDate cursor = startDate;
        LocalDate lastCursor = null;
        TerminationReason termination = TerminationReason.ALL_SOURCES_RETIRED;
        ExecutorService pool = (parallelism > 1 && active.size() > 1)
                ? Executors.newFixedThreadPool(Math.min(parallelism, active.size()), workerThreadFactory())
                : null;
        try {
            while (!active.isEmpty()) {
                if (isCancelled()) {
                    termination = TerminationReason.CANCELLED;
                    break;
                }
                if (floorDate != null && cursor.isBefore(floorDate)) {
                    termination = TerminationReason.FLOOR_DATE_CROSSED;
                    break;
                }

                log.info("Walking date={} activeSources={}", cursor, active.size());
                Map<SourceTarget, RunVerdict> verdicts = pool == null
                        ? runSequential(active, cursor, mode)
                        : runParallel(pool, active, cursor, mode);
                lastCursor = cursor;

                boolean cancelledDuringDay = false;
                List<SourceTarget> retired = new ArrayList<>();
                for (SourceTarget s : active) {
                    RunVerdict v = verdicts.get(s);
                    if (v == null) continue; // not walked because the run was cancelled
                    reports.get(s).add(cursor, v);
                    if (v.reason() == StopReason.CANCELLED) cancelledDuringDay = true;
                    if (v.stopped()) {
                        retired.add(s);
                        log.info("Source retired source={} date={} reason={}", s, cursor, v.reason());
                    }
                }
                active.removeAll(retired);

                if (cancelledDuringDay || isCancelled()) {
                    termination = TerminationReason.CANCELLED;
                    break;
                }
                cursor = cursor.minusDays(1);
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        CrawlReport report = new CrawlReport(mode, startDate, floorDate, lastCursor, termination,
                new ArrayList<>(reports.values()), startedAt, clock.instant());
        log.info("Crawl run finished termination={} lastDate={} inserted={} stillActive={}",
                termination, lastCursor, report.totalInserted(), active);
        for (SourceReport r : report.sources()) {
            log.info("  {}", r);
        }
        return report;
    }

    private Map<SourceTarget, RunVerdict> runSequential(List<SourceTarget> active, LocalDate date, CrawlMode mode) {
        Map<SourceTarget, RunVerdict> out = new LinkedHashMap<>();
        for (SourceTarget s : active) {
            if (isCancelled()) break;
            out.put(s, runSafely(s, date, mode));
        }
        return out;
    }

    private Map<SourceTarget, RunVerdict> runParallel(ExecutorService pool, List<SourceTarget> active,
                                                      LocalDate date, CrawlMode mode) {
        Map<SourceTarget, Future<RunVerdict>> futures = new LinkedHashMap<>();
        Map<SourceTarget, AtomicBoolean> timedOut = new LinkedHashMap<>();
        for (SourceTarget s : active) {
            AtomicBoolean expired = new AtomicBoolean(false);
            timedOut.put(s, expired);
            futures.put(s, pool.submit(() -> runSafely(s, date, mode, () -> expired.get() || isCancelled())));
        }

        Map<SourceTarget, RunVerdict> out = new LinkedHashMap<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(dayTimeoutMs);
        for (Map.Entry<SourceTarget, Future<RunVerdict>> e : futures.entrySet()) {
            SourceTarget s = e.getKey();
            Future<RunVerdict> f = e.getValue();
            try {
                long nanosLeft = Math.max(0, deadline - System.nanoTime());
                out.put(s, f.get(nanosLeft, TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                log.error("Source timed out source={} date={} after {} ms", s, date, dayTimeoutMs);
                timedOut.get(s).set(true);
                out.put(s, awaitTimedOut(s, date, f));
            } catch (ExecutionException ex) {
                log.error("Source failed source={} date={}", s, date, ex.getCause());
                out.put(s, RunVerdict.error());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancelRequested = true;
                futures.values().forEach(other -> other.cancel(true));
                break;
            }
        }
        return out;
    }

    /**
     * Gives a timed-out walk a short grace period to finish its in-flight reference, so that work it
     * already wrote to the sink is still counted. The source is retired with {@link StopReason#ERROR}
     * either way.
     */
    private RunVerdict awaitTimedOut(SourceTarget source, LocalDate date, Future<RunVerdict> f) {
        try {
            RunVerdict v = f.get(TIMEOUT_GRACE_MS, TimeUnit.MILLISECONDS);
            return new RunVerdict(true, v.insertedCount(), StopReason.ERROR, v.duplicateCount(),
                    v.skippedCount(), v.sinkFailures());
        } catch (TimeoutException | ExecutionException ex) {
            f.cancel(true);
            log.warn("Timed-out source did not wind down source={} date={}; its counts for the day are lost", source, date);
            return RunVerdict.error();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancelRequested = true;
            f.cancel(true);
            return RunVerdict.error();
        }
    }

    private RunVerdict runSafely(SourceTarget source, LocalDate date, CrawlMode mode) {
        return runSafely(source, date, mode, this::isCancelled);
    }

    private RunVerdict runSafely(SourceTarget source, LocalDate date, CrawlMode mode, BooleanSupplier cancelled) {
        try {
            return runner.runDay(source, date, mode, cancelled);
        } catch (RuntimeException e) {
            log.error("Unexpected failure source={} date={}; retiring source", source, date, e);
            return RunVerdict.error();
        }
    }

    private boolean isCancelled() {
        return cancelRequested || Thread.currentThread().isInterrupted();
    }

    /**
     * Asks the current run to stop. The reference being processed finishes its sink write and dedup
     * record first.
     */
    public void cancel() {
        if (running.get()) {
            log.info("Cancellation requested");
            cancelRequested = true;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public CrawlRunState getState() {
        return state;
    }

    /** Report of the most recent finished run, or null. */
    public CrawlReport lastReport() {
        return lastReport;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "crawl-source-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
