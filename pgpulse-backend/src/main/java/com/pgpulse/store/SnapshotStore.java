package com.pgpulse.store;

import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.SystemMetricSample;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable storage for the system metrics time series and the per-day query leaderboard.
 *
 * <p>Point queries only; the admission and retention rules live in
 * {@code LeaderboardMaintainer} and {@code RetentionSweeper}. Days are stored as ISO-8601 text
 * so that string comparison orders them chronologically.
 */
@Slf4j
@Repository
public class SnapshotStore {

    private static final String CREATE_SYSTEM_METRICS = """
            CREATE TABLE IF NOT EXISTS system_metrics (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              timestamp INTEGER NOT NULL,
              active_connections INTEGER NOT NULL,
              cache_hit_ratio REAL,
              db_size_bytes INTEGER NOT NULL,
              total_transactions INTEGER NOT NULL DEFAULT 0,
              tps REAL NOT NULL DEFAULT 0,
              source TEXT
            )""";

    private static final String CREATE_SYSTEM_METRICS_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_system_metrics_timestamp ON system_metrics (timestamp)";

    private static final String CREATE_DAILY_TOP_QUERIES = """
            CREATE TABLE IF NOT EXISTS daily_top_queries (
              day TEXT NOT NULL,
              query_id TEXT NOT NULL,
              query_text TEXT NOT NULL,
              mean_time_ms REAL NOT NULL,
              max_time_ms REAL NOT NULL,
              total_time_ms REAL NOT NULL,
              calls INTEGER NOT NULL,
              row_count INTEGER NOT NULL,
              shared_blks_read INTEGER NOT NULL,
              shared_blks_hit INTEGER NOT NULL,
              last_seen INTEGER NOT NULL,
              PRIMARY KEY (day, query_id)
            )""";

    private static final String CREATE_DAILY_TOP_QUERIES_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_daily_top_queries_mean ON daily_top_queries (day, mean_time_ms, last_seen)";

    private static final String ENTRY_COLUMNS = "day, query_id, query_text, mean_time_ms, max_time_ms, total_time_ms, "
            + "calls, row_count, shared_blks_read, shared_blks_hit, last_seen";

    private static final RowMapper<SystemMetricSample> SAMPLE_ROW_MAPPER = (rs, rowNum) -> {
        double ratio = rs.getDouble("cache_hit_ratio");
        Double cacheHitRatio = rs.wasNull() ? null : ratio;
        return SystemMetricSample.builder()
                .timestamp(rs.getLong("timestamp"))
                .activeConnections(rs.getLong("active_connections"))
                .cacheHitRatio(cacheHitRatio)
                .dbSizeBytes(rs.getLong("db_size_bytes"))
                .totalTransactions(rs.getLong("total_transactions"))
                .tps(rs.getDouble("tps"))
                .source(rs.getString("source"))
                .build();
    };

    private static final RowMapper<DailyLeaderboardEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> DailyLeaderboardEntry.builder()
            .day(LocalDate.parse(rs.getString("day")))
            .queryId(rs.getString("query_id"))
            .queryText(rs.getString("query_text"))
            .meanTimeMs(rs.getDouble("mean_time_ms"))
            .maxTimeMs(rs.getDouble("max_time_ms"))
            .totalTimeMs(rs.getDouble("total_time_ms"))
            .calls(rs.getLong("calls"))
            .rows(rs.getLong("row_count"))
            .sharedBlocksRead(rs.getLong("shared_blks_read"))
            .sharedBlocksHit(rs.getLong("shared_blks_hit"))
            .lastSeen(rs.getLong("last_seen"))
            .build();

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public SnapshotStore(JdbcTemplate snapshotJdbcTemplate) {
        this.jdbc = snapshotJdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(
                new DataSourceTransactionManager(Objects.requireNonNull(snapshotJdbcTemplate.getDataSource())));
    }

    /**
     * Creates tables and indexes if they do not exist yet.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbc.execute(CREATE_SYSTEM_METRICS);
        addSourceColumnIfMissing();
        jdbc.execute(CREATE_SYSTEM_METRICS_INDEX);
        jdbc.execute(CREATE_DAILY_TOP_QUERIES);
        jdbc.execute(CREATE_DAILY_TOP_QUERIES_INDEX);
        log.debug("Snapshot store schema ready");
    }

    // Files created before samples carried their source lack the column.
    private void addSourceColumnIfMissing() {
        List<String> columns = jdbc.query("PRAGMA table_info(system_metrics)", (rs, rowNum) -> rs.getString("name"));
        if (!columns.contains("source")) {
            jdbc.execute("ALTER TABLE system_metrics ADD COLUMN source TEXT");
            log.info("Added source column to system_metrics");
        }
    }

    // --- system_metrics ---

    public void insertSample(SystemMetricSample sample) {
        jdbc.update(
                "INSERT INTO system_metrics (timestamp, active_connections, cache_hit_ratio, db_size_bytes, total_transactions, tps, source) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                sample.getTimestamp(),
                sample.getActiveConnections(),
                sample.getCacheHitRatio(),
                sample.getDbSizeBytes(),
                sample.getTotalTransactions(),
                sample.getTps(),
                sample.getSource());
    }

    public Optional<SystemMetricSample> findLatestSample() {
        List<SystemMetricSample> list = jdbc.query(
                "SELECT * FROM system_metrics ORDER BY timestamp DESC, id DESC LIMIT 1",
                SAMPLE_ROW_MAPPER);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * Returns the newest sample taken from {@code source}.
     */
    public Optional<SystemMetricSample> findLatestSample(String source) {
        List<SystemMetricSample> list = jdbc.query(
                "SELECT * FROM system_metrics WHERE source = ? ORDER BY timestamp DESC, id DESC LIMIT 1",
                SAMPLE_ROW_MAPPER, source);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * Returns samples with a timestamp strictly after {@code sinceExclusive}, oldest first.
     */
    public List<SystemMetricSample> findSamplesAfter(long sinceExclusive) {
        return jdbc.query(
                "SELECT * FROM system_metrics WHERE timestamp > ? ORDER BY timestamp ASC, id ASC",
                SAMPLE_ROW_MAPPER, sinceExclusive);
    }

    public int countSamples() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM system_metrics", Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Deletes samples with a timestamp strictly before {@code cutoff}.
     *
     * @return number of deleted rows
     */
    public int deleteSamplesBefore(long cutoff) {
        return jdbc.update("DELETE FROM system_metrics WHERE timestamp < ?", cutoff);
    }

    // --- daily_top_queries ---

    public Optional<DailyLeaderboardEntry> findEntry(LocalDate day, String queryId) {
        List<DailyLeaderboardEntry> list = jdbc.query(
                "SELECT " + ENTRY_COLUMNS + " FROM daily_top_queries WHERE day = ? AND query_id = ?",
                ENTRY_ROW_MAPPER, day.toString(), queryId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public int countEntries(LocalDate day) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM daily_top_queries WHERE day = ?", Integer.class, day.toString());
        return count != null ? count : 0;
    }

    /**
     * Returns the eviction victim for {@code day}: the entry with the lowest mean time; among equal
     * means the one seen least recently, then the smallest query id.
     */
    public Optional<DailyLeaderboardEntry> findMinimumEntry(LocalDate day) {
        List<DailyLeaderboardEntry> list = jdbc.query(
                "SELECT " + ENTRY_COLUMNS + " FROM daily_top_queries WHERE day = ? "
                        + "ORDER BY mean_time_ms ASC, last_seen ASC, query_id ASC LIMIT 1",
                ENTRY_ROW_MAPPER, day.toString());
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * Returns all entries of {@code day}, slowest first.
     */
    public List<DailyLeaderboardEntry> findEntries(LocalDate day) {
        return jdbc.query(
                "SELECT " + ENTRY_COLUMNS + " FROM daily_top_queries WHERE day = ? "
                        + "ORDER BY mean_time_ms DESC, query_id ASC",
                ENTRY_ROW_MAPPER, day.toString());
    }

    public void insertEntry(DailyLeaderboardEntry entry) {
        jdbc.update(
                "INSERT INTO daily_top_queries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getDay().toString(),
                entry.getQueryId(),
                entry.getQueryText(),
                entry.getMeanTimeMs(),
                entry.getMaxTimeMs(),
                entry.getTotalTimeMs(),
                entry.getCalls(),
                entry.getRows(),
                entry.getSharedBlocksRead(),
                entry.getSharedBlocksHit(),
                entry.getLastSeen());
    }

    /**
     * Overwrites every mutable column of the entry identified by (day, queryId).
     *
     * @return number of updated rows (0 or 1)
     */
    public int updateEntry(DailyLeaderboardEntry entry) {
        return jdbc.update(
                "UPDATE daily_top_queries SET query_text = ?, mean_time_ms = ?, max_time_ms = ?, total_time_ms = ?, "
                        + "calls = ?, row_count = ?, shared_blks_read = ?, shared_blks_hit = ?, last_seen = ? "
                        + "WHERE day = ? AND query_id = ?",
                entry.getQueryText(),
                entry.getMeanTimeMs(),
                entry.getMaxTimeMs(),
                entry.getTotalTimeMs(),
                entry.getCalls(),
                entry.getRows(),
                entry.getSharedBlocksRead(),
                entry.getSharedBlocksHit(),
                entry.getLastSeen(),
                entry.getDay().toString(),
                entry.getQueryId());
    }

    public int deleteEntry(LocalDate day, String queryId) {
        return jdbc.update("DELETE FROM daily_top_queries WHERE day = ? AND query_id = ?", day.toString(), queryId);
    }

    /**
     * Replaces the entry {@code victimQueryId} of {@code entry}'s day with {@code entry} in one
     * transaction. If the insert fails the victim is kept.
     */
    public void replaceEntry(String victimQueryId, DailyLeaderboardEntry entry) {
        transactionTemplate.executeWithoutResult(status -> {
            deleteEntry(entry.getDay(), victimQueryId);
            insertEntry(entry);
        });
    }

    /**
     * Deletes the {@code count} lowest-ranked entries of {@code day}, in eviction order.
     *
     * @return number of deleted rows
     */
    public int deleteLowestEntries(LocalDate day, int count) {
        if (count <= 0) {
            return 0;
        }
        return jdbc.update(
                "DELETE FROM daily_top_queries WHERE day = ? AND query_id IN ("
                        + "SELECT query_id FROM daily_top_queries WHERE day = ? "
                        + "ORDER BY mean_time_ms ASC, last_seen ASC, query_id ASC LIMIT ?)",
                day.toString(), day.toString(), count);
    }

    /**
     * Deletes entries whose day is strictly before {@code day}.
     *
     * @return number of deleted rows
     */
    public int deleteEntriesBefore(LocalDate day) {
        return jdbc.update("DELETE FROM daily_top_queries WHERE day < ?", day.toString());
    }
}
