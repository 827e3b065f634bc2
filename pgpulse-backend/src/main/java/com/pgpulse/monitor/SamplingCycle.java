package com.pgpulse.monitor;

import com.pgpulse.collector.CollectionException;
import com.pgpulse.collector.MetricsCollector;
import com.pgpulse.leaderboard.LeaderboardMaintainer;
import com.pgpulse.model.CollectionSnapshot;
import com.pgpulse.model.ConnectionProfile;
import com.pgpulse.model.SystemMetricSample;
import com.pgpulse.retention.RetentionSweeper;
import com.pgpulse.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * One sampling cycle: collect, persist the sample, merge candidates into today's leaderboard,
 * then sweep old data.
 *
 * <p>Steps fail independently. A failed collection skips the sample and leaderboard writes; the
 * sweep always runs. No exception escapes {@link #run(ConnectionProfile)}.
 */
@Component
public class SamplingCycle {
    private static final Logger log = LoggerFactory.getLogger(SamplingCycle.class);

    private final MetricsCollector collector;
    private final SnapshotStore store;
    private final LeaderboardMaintainer maintainer;
    private final RetentionSweeper sweeper;
    private final Clock clock;

    public SamplingCycle(
            MetricsCollector collector,
            SnapshotStore store,
            LeaderboardMaintainer maintainer,
            RetentionSweeper sweeper,
            Clock clock
    ) {
        this.collector = collector;
        this.store = store;
        this.maintainer = maintainer;
        this.sweeper = sweeper;
        this.clock = clock;
    }

    /**
     * Runs the cycle against {@code profile}.
     *
     * @param profile target database
     * @return per-step outcome
     */
    public CycleResult run(ConnectionProfile profile) {
        CycleResult result = new CycleResult();
        long now = clock.millis();
        LocalDate today = LocalDate.now(clock);

        CollectionSnapshot snapshot = null;
        try {
            snapshot = collector.collect(profile);
            result.setCollected(true);
        } catch (CollectionException e) {
            log.warn("Monitoring cycle skipped: database={}, reason={}", profile.getDatabase(), e.getMessage());
            result.setFailure(e.getMessage());
        } catch (Exception e) {
            log.error("Monitoring cycle failed: database={}", profile.getDatabase(), e);
            result.setFailure(e.getMessage());
        }

        if (snapshot != null) {
            try {
                persistSample(snapshot.getSample(), profile.targetKey());
                result.setSamplePersisted(true);
            } catch (Exception e) {
                log.error("Failed to store system metrics sample", e);
                result.setFailure(e.getMessage());
            }

            try {
                result.setUpsert(maintainer.upsert(today, snapshot.getCandidates(), now));
            } catch (Exception e) {
                log.error("Failed to update daily leaderboard: day={}", today, e);
                result.setFailure(e.getMessage());
            }
        }

        try {
            result.setSweep(sweeper.sweep(now, today));
        } catch (Exception e) {
            log.error("Retention sweep failed", e);
        }

        if (result.isSuccessful()) {
            log.info("Metrics collected: database={}, candidates={}, leaderboard_writes={}",
                    profile.getDatabase(), snapshot.getCandidates().size(), result.getUpsert().getWrites());
        }
        return result;
    }

    // The rate is only meaningful against a previous reading of the same database.
    private void persistSample(SystemMetricSample sample, String source) {
        double tps = store.findLatestSample(source)
                .map(previous -> transactionsPerSecond(previous, sample))
                .orElse(0.0);
        store.insertSample(sample.toBuilder().tps(tps).source(source).build());
    }

    /**
     * Transaction rate between two cumulative counter readings. Zero when the clock did not advance
     * or the counter went backwards (statistics reset or server restart).
     */
    static double transactionsPerSecond(SystemMetricSample previous, SystemMetricSample current) {
        long elapsedMs = current.getTimestamp() - previous.getTimestamp();
        long delta = current.getTotalTransactions() - previous.getTotalTransactions();
        if (elapsedMs <= 0 || delta < 0) {
            return 0.0;
        }
        return delta * 1000.0 / elapsedMs;
    }
}
