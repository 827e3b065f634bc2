package com.pgpulse.retention;

import com.pgpulse.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Trims the snapshot store: samples older than the retention window and leaderboard rows of past
 * days. Running it again with the same arguments deletes nothing more.
 */
@Slf4j
@Component
public class RetentionSweeper {

    private final SnapshotStore store;
    private final Duration sampleRetention;

    @Autowired
    public RetentionSweeper(SnapshotStore store, @Value("${pgpulse.retention.sample-hours:24}") long sampleRetentionHours) {
        this(store, Duration.ofHours(sampleRetentionHours));
    }

    public RetentionSweeper(SnapshotStore store, Duration sampleRetention) {
        if (sampleRetention.isNegative() || sampleRetention.isZero()) {
            throw new IllegalArgumentException("sample retention must be positive: " + sampleRetention);
        }
        this.store = store;
        this.sampleRetention = sampleRetention;
    }

    /**
     * Deletes samples with {@code timestamp < now - retention} and entries with {@code day < today}.
     *
     * @param now epoch millis
     * @param today current leaderboard day
     * @return deleted row counts
     */
    public SweepResult sweep(long now, LocalDate today) {
        long cutoff = now - sampleRetention.toMillis();
        int samples = store.deleteSamplesBefore(cutoff);
        int entries = store.deleteEntriesBefore(today);
        SweepResult result = new SweepResult(samples, entries);
        if (!result.isEmpty()) {
            log.info("Retention sweep removed {} old metrics and {} old query records", samples, entries);
        }
        return result;
    }
}
