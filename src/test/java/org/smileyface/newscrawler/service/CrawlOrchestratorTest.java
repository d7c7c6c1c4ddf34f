package org.smileyface.newscrawler.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.ExcludedUrlFilter;
import org.smileyface.newscrawler.crawler.InMemoryDedupIndex;
import org.smileyface.newscrawler.extractor.ArticleExtractor;
import org.smileyface.newscrawler.extractor.PublishedAtNormalizer;
import org.smileyface.newscrawler.fetch.JsoupPageFetcher;
import org.smileyface.newscrawler.listing.ListingWalker;
import org.smileyface.newscrawler.model.CrawlMode;
import org.smileyface.newscrawler.model.CrawlReport;
import org.smileyface.newscrawler.model.CrawlRunState;
import org.smileyface.newscrawler.model.RunVerdict;
import org.smileyface.newscrawler.model.SourceReport;
import org.smileyface.newscrawler.model.SourceTarget;
import org.smileyface.newscrawler.model.StopReason;
import org.smileyface.newscrawler.model.TerminationReason;
import org.smileyface.newscrawler.testutil.FakeNewsSite;
import org.smileyface.newscrawler.testutil.RecordingSink;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CrawlOrchestratorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 12, 15);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-12-15T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final SourceTarget MK = new SourceTarget("매일경제", "001");
    private static final SourceTarget HK = new SourceTarget("한국경제", "002");

    private FakeNewsSite site;
    private InMemoryDedupIndex dedup;
    private RecordingSink sink;
    private SourceDayRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        site = FakeNewsSite.start();
        dedup = new InMemoryDedupIndex();
        sink = new RecordingSink();
        CrawlerProperties props = site.properties();
        ExcludedUrlFilter filter = ExcludedUrlFilter.from(props);
        JsoupPageFetcher fetcher = new JsoupPageFetcher("test-agent");
        runner = new SourceDayRunner(
                new ListingWalker(fetcher, props, filter),
                new ArticleExtractor(fetcher, props, filter, new PublishedAtNormalizer()),
                dedup, sink, filter, props);

        site.listing("001", TODAY, List.of(List.of("/mk/1", "/mk/2")));
        site.listing("001", TODAY.minusDays(1), List.of(List.of("/mk/3")));
        site.listing("002", TODAY, List.of(List.of("/hk/1")));
        site.listing("002", TODAY.minusDays(2), List.of(List.of("/hk/2")));
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private CrawlOrchestrator orchestrator(int parallelism) {
        return new CrawlOrchestrator(runner, CLOCK, parallelism, 60_000);
    }

    private static SourceReport reportOf(CrawlReport report, SourceTarget source) {
        return report.sources().stream().filter(r -> r.getSource().equals(source)).findFirst().orElseThrow();
    }

    @Test
    void incremental_secondRunInsertsNothing() {
        CrawlOrchestrator orchestrator = orchestrator(1);

        CrawlReport first = orchestrator.run(List.of(MK, HK), CrawlMode.INCREMENTAL, TODAY.minusDays(2));

        assertThat(first.totalInserted()).isEqualTo(5);
        assertThat(first.termination()).isEqualTo(TerminationReason.FLOOR_DATE_CROSSED);
        assertThat(first.lastCursor()).isEqualTo(TODAY.minusDays(2));
        assertThat(first.startDate()).isEqualTo(TODAY);

        CrawlReport second = orchestrator.run(List.of(MK, HK), CrawlMode.INCREMENTAL, null);

        assertThat(second.totalInserted()).isZero();
        assertThat(second.termination()).isEqualTo(TerminationReason.ALL_SOURCES_RETIRED);
        assertThat(second.lastCursor()).isEqualTo(TODAY);
        assertThat(reportOf(second, MK).getRetiredReason()).isEqualTo(StopReason.FRONTIER_REACHED);
        assertThat(sink.urls()).hasSize(5);
        assertThat(orchestrator.lastReport()).isSameAs(second);
        assertThat(orchestrator.getState()).isEqualTo(CrawlRunState.COMPLETED);
    }

    @Test
    void retiredSourceIsNotWalkedAgain() {
        dedup.record(site.url("/mk/1"));

        CrawlReport report = orchestrator(1).run(List.of(MK, HK), CrawlMode.INCREMENTAL, TODAY.minusDays(3));

        SourceReport mk = reportOf(report, MK);
        assertThat(mk.isRetired()).isTrue();
        assertThat(mk.getRetiredOn()).isEqualTo(TODAY);
        assertThat(mk.getDaysVisited()).isEqualTo(1);
        assertThat(mk.getInsertedCount()).isZero();
        assertThat(site.listingHits("001")).isEqualTo(1);

        SourceReport hk = reportOf(report, HK);
        assertThat(hk.isRetired()).isFalse();
        assertThat(hk.getDaysVisited()).isEqualTo(4);
        assertThat(site.listingHits("002")).isEqualTo(4);
        assertThat(report.termination()).isEqualTo(TerminationReason.FLOOR_DATE_CROSSED);
    }

    @Test
    void gapFilling_visitsEveryDayDownToFloor() {
        dedup.record(site.url("/mk/1"));

        CrawlReport report = orchestrator(1).run(List.of(MK, HK), CrawlMode.GAP_FILLING, TODAY.minusDays(2));

        SourceReport mk = reportOf(report, MK);
        assertThat(mk.isRetired()).isFalse();
        assertThat(mk.getDaysVisited()).isEqualTo(3);
        assertThat(mk.getInsertedCount()).isEqualTo(2);
        assertThat(mk.getDuplicateCount()).isEqualTo(1);
        assertThat(reportOf(report, HK).getInsertedCount()).isEqualTo(2);
        assertThat(report.termination()).isEqualTo(TerminationReason.FLOOR_DATE_CROSSED);
        assertThat(report.lastCursor()).isEqualTo(TODAY.minusDays(2));
    }

    @Test
    void gapFilling_tenDaysWithKnownArticlesMidway() {
        SourceTarget edaily = new SourceTarget("이데일리", "018");
        for (int day = 1; day <= 10; day++) {
            site.listing("018", TODAY.minusDays(day - 1), List.of(List.of("/ed/" + day + "/1", "/ed/" + day + "/2")));
        }
        dedup.record(site.url("/ed/3/1"));
        dedup.record(site.url("/ed/7/2"));

        CrawlReport report = orchestrator(1).run(List.of(edaily), CrawlMode.GAP_FILLING, TODAY.minusDays(9));

        SourceReport ed = reportOf(report, edaily);
        assertThat(ed.getInsertedCount()).isEqualTo(18);
        assertThat(ed.getDuplicateCount()).isEqualTo(2);
        assertThat(ed.getDaysVisited()).isEqualTo(10);
        assertThat(ed.isRetired()).isFalse();
        assertThat(site.listingHits("018")).isEqualTo(10);
        assertThat(report.termination()).isEqualTo(TerminationReason.FLOOR_DATE_CROSSED);
        assertThat(report.lastCursor()).isEqualTo(TODAY.minusDays(9));
    }

    @Test
    void explicitStartDateSkipsNewerDays() {
        CrawlReport report = orchestrator(1).run(List.of(MK), CrawlMode.GAP_FILLING, TODAY.minusDays(1), TODAY.minusDays(1));

        assertThat(report.startDate()).isEqualTo(TODAY.minusDays(1));
        assertThat(sink.urls()).containsExactly(site.url("/mk/3"));
        assertThat(site.pageHits("/mk/1")).isZero();
    }

    @Test
    void unavailableListingRetiresSourceInIncrementalMode() {
        site.unavailable("001", TODAY);

        CrawlReport report = orchestrator(1).run(List.of(MK, HK), CrawlMode.INCREMENTAL, TODAY);

        assertThat(reportOf(report, MK).getRetiredReason()).isEqualTo(StopReason.LISTING_UNAVAILABLE);
        assertThat(reportOf(report, HK).isRetired()).isFalse();
        assertThat(report.totalInserted()).isEqualTo(1);
    }

    @Test
    void parallelRunGivesSameResult() {
        dedup.record(site.url("/mk/1"));

        CrawlReport report = orchestrator(4).run(List.of(MK, HK), CrawlMode.GAP_FILLING, TODAY.minusDays(2));

        assertThat(report.totalInserted()).isEqualTo(4);
        assertThat(reportOf(report, MK).getDaysVisited()).isEqualTo(3);
        assertThat(reportOf(report, HK).getDaysVisited()).isEqualTo(3);
        assertThat(sink.urls()).containsExactlyInAnyOrder(
                site.url("/mk/2"), site.url("/mk/3"), site.url("/hk/1"), site.url("/hk/2"));
    }

    @Test
    void gapFillingWithoutFloorIsRejected() {
        assertThatThrownBy(() -> orchestrator(1).run(List.of(MK), CrawlMode.GAP_FILLING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unexpectedRunnerFailureRetiresOnlyThatSource() {
        SourceDayRunner failing = mock(SourceDayRunner.class);
        when(failing.runDay(eq(MK), any(LocalDate.class), any(CrawlMode.class), any(BooleanSupplier.class)))
                .thenThrow(new IllegalStateException("boom"));
        when(failing.runDay(eq(HK), any(LocalDate.class), any(CrawlMode.class), any(BooleanSupplier.class)))
                .thenReturn(new RunVerdict(false, 1, StopReason.EXHAUSTED, 0, 0, List.of()));

        CrawlReport report = new CrawlOrchestrator(failing, CLOCK, 1, 0)
                .run(List.of(MK, HK), CrawlMode.INCREMENTAL, TODAY.minusDays(1));

        assertThat(reportOf(report, MK).getRetiredReason()).isEqualTo(StopReason.ERROR);
        assertThat(reportOf(report, MK).getDaysVisited()).isEqualTo(1);
        assertThat(reportOf(report, HK).getDaysVisited()).isEqualTo(2);
        assertThat(report.totalInserted()).isEqualTo(2);
    }

    @Test
    void timedOutSourceKeepsItsWrittenCountAndIsRetired() {
        SourceDayRunner slow = mock(SourceDayRunner.class);
        when(slow.runDay(eq(MK), any(LocalDate.class), any(CrawlMode.class), any(BooleanSupplier.class)))
                .thenReturn(new RunVerdict(false, 1, StopReason.EXHAUSTED, 0, 0, List.of()));
        when(slow.runDay(eq(HK), any(LocalDate.class), any(CrawlMode.class), any(BooleanSupplier.class)))
                .thenAnswer(inv -> {
                    BooleanSupplier cancelled = inv.getArgument(3);
                    int written = 0;
                    while (!cancelled.getAsBoolean()) {
                        written = 3;
                        Thread.sleep(20);
                    }
                    return new RunVerdict(false, written, StopReason.CANCELLED, 0, 0, List.of());
                });

        CrawlReport report = new CrawlOrchestrator(slow, CLOCK, 2, 200)
                .run(List.of(MK, HK), CrawlMode.INCREMENTAL, TODAY);

        SourceReport hk = reportOf(report, HK);
        assertThat(hk.getRetiredReason()).isEqualTo(StopReason.ERROR);
        assertThat(hk.getInsertedCount()).isEqualTo(3);
        assertThat(reportOf(report, MK).getInsertedCount()).isEqualTo(1);
        assertThat(report.termination()).isEqualTo(TerminationReason.FLOOR_DATE_CROSSED);
    }

    @Test
    void concurrentRunIsRejectedAndCancelStopsTheRun() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SourceDayRunner blocking = mock(SourceDayRunner.class);
        when(blocking.runDay(any(SourceTarget.class), any(LocalDate.class), any(CrawlMode.class), any(BooleanSupplier.class)))
                .thenAnswer(inv -> {
                    entered.countDown();
                    release.await(10, TimeUnit.SECONDS);
                    return new RunVerdict(false, 0, StopReason.EXHAUSTED, 0, 0, List.of());
                });
        CrawlOrchestrator orchestrator = new CrawlOrchestrator(blocking, CLOCK, 1, 0);

        CompletableFuture<CrawlReport> running = CompletableFuture.supplyAsync(
                () -> orchestrator.run(List.of(MK), CrawlMode.INCREMENTAL, TODAY.minusDays(30)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.getState()).isEqualTo(CrawlRunState.RUNNING);
        assertThatThrownBy(() -> orchestrator.run(List.of(HK), CrawlMode.INCREMENTAL, null))
                .isInstanceOf(IllegalStateException.class);

        orchestrator.cancel();
        release.countDown();
        CrawlReport report = running.get(10, TimeUnit.SECONDS);

        assertThat(report.termination()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(report.lastCursor()).isEqualTo(TODAY);
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.getState()).isEqualTo(CrawlRunState.CANCELLED);
    }
}
