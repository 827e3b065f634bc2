package com.pgpulse.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Result of one collection against the target database.
 */
@Data
@AllArgsConstructor
public class CollectionSnapshot {
    private SystemMetricSample sample;
    private List<QueryStatCandidate> candidates;
}
