package com.pgpulse.retention;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Rows removed by one retention sweep.
 */
@Data
@AllArgsConstructor
public class SweepResult {
    private int samplesDeleted;
    private int entriesDeleted;

    public boolean isEmpty() {
        return samplesDeleted == 0 && entriesDeleted == 0;
    }
}
