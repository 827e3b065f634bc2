package com.pgpulse.monitor;

import com.pgpulse.leaderboard.UpsertSummary;
import com.pgpulse.retention.SweepResult;
import lombok.Data;

/**
 * What one sampling cycle achieved. Fields of steps that did not run or failed stay null.
 */
@Data
public class CycleResult {
    private boolean collected;
    private boolean samplePersisted;
    private UpsertSummary upsert;
    private SweepResult sweep;
    private String failure;

    public boolean isSuccessful() {
        return collected && samplePersisted && upsert != null && sweep != null;
    }
}
