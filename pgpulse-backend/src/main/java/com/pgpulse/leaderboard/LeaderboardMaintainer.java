package com.pgpulse.leaderboard;

import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.QueryStatCandidate;
import com.pgpulse.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the per-day leaderboard of the slowest statements, bounded to {@code capacity} entries.
 *
 * <p>Each candidate is merged on its own:
 * <ul>
 *   <li>a known fingerprint is overwritten only when its mean time went up; the max time is the
 *   running maximum of observed means;</li>
 *   <li>an unknown fingerprint is inserted while the day has room;</li>
 *   <li>on a full day it replaces the current minimum if it is strictly slower, and is dropped
 *   otherwise. The swap is one transaction.</li>
 * </ul>
 * A day holding more than {@code capacity} entries (after the size was lowered) is trimmed to
 * {@code capacity} first. Every change is written through to the {@link SnapshotStore}; nothing is
 * cached between calls.
 */
@Slf4j
@Component
public class LeaderboardMaintainer {

    public static final int DEFAULT_CAPACITY = 20;

    private final SnapshotStore store;
    private final int capacity;

    public LeaderboardMaintainer(SnapshotStore store, @Value("${pgpulse.leaderboard.size:20}") int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("leaderboard size must be positive: " + capacity);
        }
        this.store = store;
        this.capacity = capacity;
    }

    /**
     * Merges {@code candidates} into the leaderboard of {@code day}.
     *
     * @param day leaderboard day
     * @param candidates candidates in incoming order
     * @param now epoch millis stamped as last_seen on every write
     * @return counters of what happened to the candidates
     */
    public synchronized UpsertSummary upsert(LocalDate day, List<QueryStatCandidate> candidates, long now) {
        UpsertSummary summary = new UpsertSummary();
        trimToCapacity(day, summary);
        if (candidates == null || candidates.isEmpty()) {
            return summary;
        }

        for (QueryStatCandidate candidate : candidates) {
            if (candidate == null || candidate.getQueryId() == null) {
                summary.recordDropped();
                continue;
            }
            merge(day, candidate, now, summary);
        }

        log.debug("Leaderboard upsert: day={}, candidates={}, inserted={}, updated={}, evicted={}, dropped={}",
                day, candidates.size(), summary.getInserted(), summary.getUpdated(), summary.getEvicted(),
                summary.getDropped());
        return summary;
    }

    public int getCapacity() {
        return capacity;
    }

    private void trimToCapacity(LocalDate day, UpsertSummary summary) {
        int excess = store.countEntries(day) - capacity;
        if (excess <= 0) {
            return;
        }
        int removed = store.deleteLowestEntries(day, excess);
        summary.recordTrimmed(removed);
        log.info("Leaderboard trimmed to capacity: day={}, capacity={}, removed={}", day, capacity, removed);
    }

    private void merge(LocalDate day, QueryStatCandidate candidate, long now, UpsertSummary summary) {
        Optional<DailyLeaderboardEntry> existing = store.findEntry(day, candidate.getQueryId());
        if (existing.isPresent()) {
            DailyLeaderboardEntry current = existing.get();
            if (candidate.getMeanTimeMs() <= current.getMeanTimeMs()) {
                summary.recordUnchanged();
                return;
            }
            store.updateEntry(current.toBuilder()
                    .queryText(candidate.getQueryText())
                    .meanTimeMs(candidate.getMeanTimeMs())
                    .maxTimeMs(Math.max(current.getMaxTimeMs(), candidate.getMeanTimeMs()))
                    .totalTimeMs(candidate.getTotalTimeMs())
                    .calls(candidate.getCalls())
                    .rows(candidate.getRows())
                    .sharedBlocksRead(candidate.getSharedBlocksRead())
                    .sharedBlocksHit(candidate.getSharedBlocksHit())
                    .lastSeen(now)
                    .build());
            summary.recordUpdated();
            return;
        }

        if (store.countEntries(day) < capacity) {
            store.insertEntry(DailyLeaderboardEntry.admit(day, candidate, now));
            summary.recordInserted();
            return;
        }

        Optional<DailyLeaderboardEntry> minimum = store.findMinimumEntry(day);
        if (minimum.isEmpty() || candidate.getMeanTimeMs() <= minimum.get().getMeanTimeMs()) {
            summary.recordDropped();
            return;
        }

        store.replaceEntry(minimum.get().getQueryId(), DailyLeaderboardEntry.admit(day, candidate, now));
        summary.recordEvicted();
        log.trace("Evicted {} ({} ms) for {} ({} ms) on {}", minimum.get().getQueryId(),
                minimum.get().getMeanTimeMs(), candidate.getQueryId(), candidate.getMeanTimeMs(), day);
    }
}
