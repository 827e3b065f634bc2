package com.pgpulse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Accumulated statistics of one statement fingerprint as read from {@code pg_stat_statements}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryStatCandidate {
    private String queryId;
    private String queryText;
    private long calls;
    private double totalTimeMs;
    private double meanTimeMs;
    private long rows;
    private long sharedBlocksRead;
    private long sharedBlocksHit;
}
