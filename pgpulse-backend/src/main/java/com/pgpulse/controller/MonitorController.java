package com.pgpulse.controller;

import com.pgpulse.api.MonitoringControlResponse;
import com.pgpulse.api.MonitoringStatusResponse;
import com.pgpulse.collector.MetricsCollector;
import com.pgpulse.model.ConnectionProfile;
import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.QueryStatCandidate;
import com.pgpulse.model.SystemMetricSample;
import com.pgpulse.monitor.MonitoringScheduler;
import com.pgpulse.service.HistoryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
public class MonitorController {

    private static final Logger log = LoggerFactory.getLogger(MonitorController.class);

    private final MonitoringScheduler scheduler;
    private final HistoryService historyService;
    private final MetricsCollector metricsCollector;

    public MonitorController(
            MonitoringScheduler scheduler,
            HistoryService historyService,
            MetricsCollector metricsCollector
    ) {
        this.scheduler = scheduler;
        this.historyService = historyService;
        this.metricsCollector = metricsCollector;
    }

    /**
     * Start (or restart) background monitoring of a database.
     *
     * POST /api/monitoring/start
     */
    @PostMapping("/monitoring/start")
    public ResponseEntity<MonitoringControlResponse> startMonitoring(@Valid @RequestBody ConnectionProfile profile) {
        log.info("Start monitoring requested: profile={}, trace_id={}", profile, MDC.get("trace_id"));
        scheduler.start(profile);
        return ResponseEntity.ok(MonitoringControlResponse.builder()
                .success(true)
                .message("Monitoring started")
                .status("RUNNING")
                .build());
    }

    /**
     * Stop background monitoring. Idempotent.
     *
     * POST /api/monitoring/stop
     */
    @PostMapping("/monitoring/stop")
    public ResponseEntity<MonitoringControlResponse> stopMonitoring() {
        log.info("Stop monitoring requested: trace_id={}", MDC.get("trace_id"));
        scheduler.stop();
        return ResponseEntity.ok(MonitoringControlResponse.builder()
                .success(true)
                .message("Monitoring stopped")
                .status("STOPPED")
                .build());
    }

    /**
     * GET /api/monitoring/status
     */
    @GetMapping("/monitoring/status")
    public ResponseEntity<MonitoringStatusResponse> monitoringStatus() {
        MonitoringScheduler.Status status = scheduler.status();
        return ResponseEntity.ok(MonitoringStatusResponse.builder()
                .running(status.isRunning())
                .profile(status.getProfile())
                .build());
    }

    /**
     * System metrics of the last {@code window_minutes} (default 60), oldest first.
     *
     * GET /api/monitoring/metrics
     */
    @GetMapping("/monitoring/metrics")
    public ResponseEntity<List<SystemMetricSample>> recentMetrics(
            @RequestParam(name = "window_minutes", required = false) Integer windowMinutes
    ) {
        Duration window = windowMinutes != null ? Duration.ofMinutes(windowMinutes) : null;
        return ResponseEntity.ok(historyService.recentMetrics(window));
    }

    /**
     * Today's slowest statements, slowest first.
     *
     * GET /api/history/daily-top
     */
    @GetMapping("/history/daily-top")
    public ResponseEntity<List<DailyLeaderboardEntry>> dailyTop() {
        return ResponseEntity.ok(historyService.todayLeaderboard());
    }

    /**
     * Live statement catalogue read straight from the target database.
     *
     * POST /api/pg-stat-statements
     */
    @PostMapping("/pg-stat-statements")
    public ResponseEntity<List<QueryStatCandidate>> liveStatements(@Valid @RequestBody ConnectionProfile profile) {
        return ResponseEntity.ok(metricsCollector.fetchLiveCatalogue(profile));
    }

    /**
     * Reset the accumulated statement statistics on the target database.
     *
     * POST /api/pg-stat-statements/reset
     */
    @PostMapping("/pg-stat-statements/reset")
    public ResponseEntity<MonitoringControlResponse> resetStatements(@Valid @RequestBody ConnectionProfile profile) {
        metricsCollector.resetStatistics(profile);
        return ResponseEntity.ok(MonitoringControlResponse.builder()
                .success(true)
                .message("Statement statistics reset")
                .build());
    }
}
