package com.pgpulse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the system metrics time series. Written once per successful sampling cycle.
 *
 * <p>{@code cacheHitRatio} is null when the target reported neither block hits nor reads.
 * {@code source} identifies the monitored database as {@code host:port/database}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SystemMetricSample {
    private long timestamp;
    private long activeConnections;
    private Double cacheHitRatio;
    private long dbSizeBytes;
    private long totalTransactions;
    private double tps;
    private String source;
}
