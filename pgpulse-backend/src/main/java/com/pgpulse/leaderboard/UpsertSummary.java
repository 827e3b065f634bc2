package com.pgpulse.leaderboard;

import lombok.Data;

/**
 * Outcome counters of one {@link LeaderboardMaintainer#upsert} call.
 */
@Data
public class UpsertSummary {
    private int inserted;
    private int updated;
    private int evicted;
    private int dropped;
    private int unchanged;
    private int trimmed;

    void recordInserted() {
        inserted++;
    }

    void recordUpdated() {
        updated++;
    }

    void recordEvicted() {
        evicted++;
    }

    void recordDropped() {
        dropped++;
    }

    void recordUnchanged() {
        unchanged++;
    }

    void recordTrimmed(int count) {
        trimmed += count;
    }

    public int getWrites() {
        return inserted + updated + evicted + trimmed;
    }
}
