package com.pgpulse.service;

import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.SystemMetricSample;
import com.pgpulse.store.SnapshotStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the snapshot store for clients. Safe to call while a sampling cycle is running.
 */
@Service
public class HistoryService {

    public static final Duration DEFAULT_METRICS_WINDOW = Duration.ofHours(1);

    private final SnapshotStore store;
    private final Clock clock;

    public HistoryService(SnapshotStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the samples taken within {@code window} of now, oldest first.
     *
     * @param window lookback window, defaults to one hour when null
     * @return samples in ascending timestamp order
     */
    public List<SystemMetricSample> recentMetrics(Duration window) {
        Duration effective = window != null ? window : DEFAULT_METRICS_WINDOW;
        if (effective.isNegative() || effective.isZero()) {
            throw new IllegalArgumentException("metrics window must be positive");
        }
        return store.findSamplesAfter(clock.millis() - effective.toMillis());
    }

    /**
     * Returns today's leaderboard, slowest mean time first.
     */
    public List<DailyLeaderboardEntry> todayLeaderboard() {
        return store.findEntries(LocalDate.now(clock));
    }
}
