package com.pgpulse.collector;

import com.pgpulse.model.CollectionSnapshot;
import com.pgpulse.model.ConnectionProfile;
import com.pgpulse.model.QueryStatCandidate;
import com.pgpulse.model.SystemMetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads runtime statistics and {@code pg_stat_statements} counters from the monitored database.
 *
 * <p>Each call opens its own connection and closes it before returning, on success and on failure.
 * A failed call never returns partial results.
 */
@Component
public class MetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final TargetConnectionFactory connectionFactory;
    private final Clock clock;
    private final int candidateWindow;
    private final int liveWindow;

    /**
     * Create a metrics collector.
     *
     * @param connectionFactory factory for target connections
     * @param clock clock used to timestamp samples
     * @param candidateWindow maximum number of candidates read per cycle
     * @param liveWindow maximum number of rows returned by the live catalogue
     */
    public MetricsCollector(
            TargetConnectionFactory connectionFactory,
            Clock clock,
            @Value("${pgpulse.collector.candidate-window:50}") int candidateWindow,
            @Value("${pgpulse.collector.live-window:100}") int liveWindow
    ) {
        this.connectionFactory = connectionFactory;
        this.clock = clock;
        this.candidateWindow = candidateWindow;
        this.liveWindow = liveWindow;
    }

    /**
     * Runs one collection: system metrics plus the slowest statements by mean time.
     *
     * @param profile target database
     * @return the sample and its candidates
     * @throws CollectionException if connecting or any query fails
     */
    public CollectionSnapshot collect(ConnectionProfile profile) {
        try (Connection conn = connectionFactory.open(profile)) {
            long timestamp = clock.millis();
            SystemMetricSample sample = readSystemMetrics(conn, timestamp);
            List<QueryStatCandidate> candidates = readTopStatements(conn, candidateWindow);
            log.debug("Collected snapshot: database={}, active_connections={}, candidates={}",
                    profile.getDatabase(), sample.getActiveConnections(), candidates.size());
            return new CollectionSnapshot(sample, candidates);
        } catch (SQLException e) {
            throw translate("collect metrics", profile, e);
        }
    }

    /**
     * Reads the current statement catalogue directly from the target, bypassing the store.
     *
     * @param profile target database
     * @return up to the live window of statements, slowest mean time first
     * @throws StatementsExtensionMissingException if {@code pg_stat_statements} is not installed
     * @throws CollectionException on any other failure
     */
    public List<QueryStatCandidate> fetchLiveCatalogue(ConnectionProfile profile) {
        try (Connection conn = connectionFactory.open(profile)) {
            ensureExtensionInstalled(conn);
            return readTopStatements(conn, liveWindow);
        } catch (SQLException e) {
            throw translate("fetch statement statistics", profile, e);
        }
    }

    /**
     * Discards the statistics accumulated by {@code pg_stat_statements} on the target.
     *
     * @param profile target database
     * @throws CollectionException if the reset fails
     */
    public void resetStatistics(ConnectionProfile profile) {
        try (Connection conn = connectionFactory.open(profile);
             Statement stmt = conn.createStatement()) {
            stmt.execute(PgStatQueries.RESET_STATEMENTS);
            log.info("Reset pg_stat_statements: host={}, database={}", profile.getHost(), profile.getDatabase());
        } catch (SQLException e) {
            throw translate("reset statement statistics", profile, e);
        }
    }

    private SystemMetricSample readSystemMetrics(Connection conn, long timestamp) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(PgStatQueries.SYSTEM_METRICS)) {
            if (!rs.next()) {
                throw new SQLException("System metrics query returned no rows");
            }
            double ratio = rs.getDouble("cache_hit_ratio");
            Double cacheHitRatio = rs.wasNull() ? null : ratio;
            return SystemMetricSample.builder()
                    .timestamp(timestamp)
                    .activeConnections(rs.getLong("active_connections"))
                    .totalTransactions(rs.getLong("total_transactions"))
                    .cacheHitRatio(cacheHitRatio)
                    .dbSizeBytes(rs.getLong("db_size_bytes"))
                    .build();
        }
    }

    private List<QueryStatCandidate> readTopStatements(Connection conn, int limit) throws SQLException {
        List<QueryStatCandidate> out = new ArrayList<>();
        int skipped = 0;
        try (PreparedStatement ps = conn.prepareStatement(PgStatQueries.TOP_STATEMENTS)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String queryId = rs.getString("queryid");
                    if (queryId == null) {
                        // Rows of other users are masked when we lack pg_read_all_stats.
                        skipped++;
                        continue;
                    }
                    out.add(QueryStatCandidate.builder()
                            .queryId(queryId)
                            .queryText(rs.getString("query"))
                            .calls(rs.getLong("calls"))
                            .totalTimeMs(rs.getDouble("total_exec_time"))
                            .meanTimeMs(rs.getDouble("mean_exec_time"))
                            .rows(rs.getLong("rows"))
                            .sharedBlocksRead(rs.getLong("shared_blks_read"))
                            .sharedBlocksHit(rs.getLong("shared_blks_hit"))
                            .build());
                }
            }
        }
        if (skipped > 0) {
            log.debug("Skipped privilege-restricted statements without queryid: count={}", skipped);
        }
        return out;
    }

    private void ensureExtensionInstalled(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(PgStatQueries.EXTENSION_INSTALLED)) {
            if (!rs.next()) {
                throw new StatementsExtensionMissingException(
                        "pg_stat_statements extension is not installed. Run \"CREATE EXTENSION pg_stat_statements;\"");
            }
        }
    }

    private CollectionException translate(String action, ConnectionProfile profile, SQLException e) {
        String target = profile.targetKey();
        String detail = "Failed to " + action + " on " + target + ": " + e.getMessage();
        if (PgStatQueries.SQLSTATE_UNDEFINED_TABLE.equals(e.getSQLState())) {
            return new StatementsExtensionMissingException(detail, e);
        }
        return new CollectionException(detail, e);
    }
}
