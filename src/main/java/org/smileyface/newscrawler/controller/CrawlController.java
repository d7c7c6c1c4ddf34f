package org.smileyface.newscrawler.controller;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.CrawlMode;
import org.smileyface.newscrawler.model.CrawlReport;
import org.smileyface.newscrawler.model.SourceTarget;
import org.smileyface.newscrawler.service.CrawlOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Operator endpoints: start a run in the background, inspect it, cancel it.
 */
@RestController
@RequestMapping("/api/crawl")
class CrawlController {

    private static final Logger log = LoggerFactory.getLogger(CrawlController.class);

    private final CrawlOrchestrator orchestrator;
    private final CrawlerProperties properties;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "crawl-run");
        t.setDaemon(true);
        return t;
    });
    private Future<?> pending;

    CrawlController(CrawlOrchestrator orchestrator, CrawlerProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/run")
    public synchronized ResponseEntity<Map<String, Object>> run(@RequestBody(required = false) CrawlRunRequest request) {
        if (orchestrator.isRunning() || (pending != null && !pending.isDone())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(message("a crawl run is already in progress"));
        }

        CrawlMode mode;
        LocalDate floor;
        LocalDate start;
        List<SourceTarget> sources;
        try {
            mode = request != null && request.mode() != null ? request.mode() : properties.getMode();
            floor = request != null && request.floorDate() != null ? LocalDate.parse(request.floorDate()) : properties.getFloorDateValue();
            start = request != null && request.startDate() != null ? LocalDate.parse(request.startDate()) : properties.getStartDateValue();
            sources = request != null && request.sources() != null ? toTargets(request.sources()) : properties.getSourceTargets();
        } catch (DateTimeParseException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(message(e.getMessage()));
        }
        if (mode == CrawlMode.GAP_FILLING && floor == null) {
            return ResponseEntity.badRequest().body(message("GAP_FILLING requires a floor date"));
        }
        if (sources.isEmpty()) {
            return ResponseEntity.badRequest().body(message("no sources to crawl"));
        }

        log.info("Operator triggered crawl mode={} floor={} start={} sources={}", mode, floor, start, sources);
        pending = executor.submit(() -> {
            try {
                orchestrator.run(sources, mode, floor, start);
            } catch (RuntimeException e) {
                log.error("Operator triggered crawl failed", e);
            }
        });

        Map<String, Object> body = message("crawl started");
        body.put("mode", mode);
        body.put("floorDate", floor);
        body.put("startDate", start);
        body.put("sources", sources);
        return ResponseEntity.accepted().body(body);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", orchestrator.getState());
        body.put("running", orchestrator.isRunning());
        CrawlReport last = orchestrator.lastReport();
        body.put("lastReport", last);
        if (last != null) {
            body.put("lastInserted", last.totalInserted());
        }
        return body;
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        if (!orchestrator.isRunning()) {
            return ResponseEntity.ok(message("no crawl run in progress"));
        }
        orchestrator.cancel();
        return ResponseEntity.accepted().body(message("cancellation requested"));
    }

    @PreDestroy
    void shutdown() {
        orchestrator.cancel();
        executor.shutdownNow();
    }

    private static List<SourceTarget> toTargets(List<CrawlerProperties.SourceConfig> configs) {
        List<SourceTarget> out = new ArrayList<>();
        for (CrawlerProperties.SourceConfig c : configs) {
            out.add(new SourceTarget(c.getDisplayName(), c.getSourceId()));
        }
        return out;
    }

    private static Map<String, Object> message(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", text);
        return body;
    }
}
