package com.pgpulse.store;

import com.pgpulse.config.StoreConfig;
import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.SystemMetricSample;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SnapshotStore Tests")
class SnapshotStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 10);

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        dataSource = StoreConfig.createDataSource(tempDir, 2);
        store = new SnapshotStore(new JdbcTemplate(dataSource));
        store.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    @DisplayName("Schema initialization is repeatable")
    void initializeSchemaTwice() {
        store.initializeSchema();
        assertThat(store.countSamples()).isZero();
    }

    @Test
    @DisplayName("Samples come back oldest first and keep a missing cache hit ratio as null")
    void samplesRoundTrip() {
        store.insertSample(sample(3_000, 0.5));
        store.insertSample(sample(1_000, null));
        store.insertSample(sample(2_000, 0.99));

        List<SystemMetricSample> samples = store.findSamplesAfter(0);

        assertThat(samples).extracting(SystemMetricSample::getTimestamp).containsExactly(1_000L, 2_000L, 3_000L);
        assertThat(samples.get(0).getCacheHitRatio()).isNull();
        assertThat(samples.get(1).getCacheHitRatio()).isEqualTo(0.99);
        assertThat(store.findLatestSample()).get().extracting(SystemMetricSample::getTimestamp).isEqualTo(3_000L);
    }

    @Test
    @DisplayName("Latest sample can be looked up per monitored database")
    void latestSampleBySource() {
        store.insertSample(sample(1_000, 0.5).toBuilder().source("a:5432/app").build());
        store.insertSample(sample(2_000, 0.5).toBuilder().source("b:5432/app").build());

        assertThat(store.findLatestSample("a:5432/app")).get()
                .extracting(SystemMetricSample::getTimestamp).isEqualTo(1_000L);
        assertThat(store.findLatestSample("c:5432/app")).isEmpty();
    }

    @Test
    @DisplayName("Schema initialization adds the source column to an older metrics table")
    void upgradesOlderMetricsTable() {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP TABLE system_metrics");
        jdbc.execute("CREATE TABLE system_metrics (id INTEGER PRIMARY KEY AUTOINCREMENT, timestamp INTEGER NOT NULL, "
                + "active_connections INTEGER NOT NULL, cache_hit_ratio REAL, db_size_bytes INTEGER NOT NULL, "
                + "total_transactions INTEGER NOT NULL DEFAULT 0, tps REAL NOT NULL DEFAULT 0)");

        store.initializeSchema();
        store.insertSample(sample(1_000, 0.5).toBuilder().source("a:5432/app").build());

        assertThat(store.findLatestSample("a:5432/app")).isPresent();
    }

    @Test
    @DisplayName("findSamplesAfter excludes the boundary timestamp")
    void findSamplesAfterIsExclusive() {
        store.insertSample(sample(1_000, 0.5));
        store.insertSample(sample(2_000, 0.5));

        assertThat(store.findSamplesAfter(1_000)).extracting(SystemMetricSample::getTimestamp).containsExactly(2_000L);
    }

    @Test
    @DisplayName("Minimum entry breaks ties by oldest last_seen, then query id")
    void minimumEntryTieBreak() {
        store.insertEntry(entry("q-b", 5.0, 200));
        store.insertEntry(entry("q-a", 5.0, 200));
        store.insertEntry(entry("q-c", 5.0, 100));
        store.insertEntry(entry("q-d", 9.0, 50));

        assertThat(store.findMinimumEntry(DAY)).get().extracting(DailyLeaderboardEntry::getQueryId).isEqualTo("q-c");

        store.deleteEntry(DAY, "q-c");
        assertThat(store.findMinimumEntry(DAY)).get().extracting(DailyLeaderboardEntry::getQueryId).isEqualTo("q-a");
    }

    @Test
    @DisplayName("Entries are listed by mean time descending and scoped to their day")
    void entriesOrderedAndScopedByDay() {
        store.insertEntry(entry("fast", 1.0, 1));
        store.insertEntry(entry("slow", 30.0, 1));
        store.insertEntry(entry("medium", 7.5, 1));
        store.insertEntry(entry("slow", 30.0, 1).toBuilder().day(DAY.minusDays(1)).build());

        assertThat(store.findEntries(DAY)).extracting(DailyLeaderboardEntry::getQueryId)
                .containsExactly("slow", "medium", "fast");
        assertThat(store.countEntries(DAY)).isEqualTo(3);
        assertThat(store.countEntries(DAY.minusDays(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("updateEntry overwrites every mutable column")
    void updateEntry() {
        store.insertEntry(entry("q1", 2.0, 10));

        DailyLeaderboardEntry updated = entry("q1", 4.0, 20).toBuilder()
                .queryText("SELECT 2")
                .maxTimeMs(4.0)
                .calls(99)
                .rows(7)
                .sharedBlocksRead(3)
                .sharedBlocksHit(11)
                .totalTimeMs(396.0)
                .build();
        assertThat(store.updateEntry(updated)).isEqualTo(1);

        assertThat(store.findEntry(DAY, "q1")).contains(updated);
    }

    @Test
    @DisplayName("deleteEntriesBefore keeps the given day and later")
    void deleteEntriesBefore() {
        store.insertEntry(entry("q1", 1.0, 1).toBuilder().day(DAY.minusDays(2)).build());
        store.insertEntry(entry("q1", 1.0, 1).toBuilder().day(DAY.minusDays(1)).build());
        store.insertEntry(entry("q1", 1.0, 1));

        assertThat(store.deleteEntriesBefore(DAY)).isEqualTo(2);
        assertThat(store.countEntries(DAY)).isEqualTo(1);
    }

    private static SystemMetricSample sample(long timestamp, Double ratio) {
        return SystemMetricSample.builder()
                .timestamp(timestamp)
                .activeConnections(4)
                .cacheHitRatio(ratio)
                .dbSizeBytes(8_192)
                .totalTransactions(100)
                .build();
    }

    static DailyLeaderboardEntry entry(String queryId, double mean, long lastSeen) {
        return DailyLeaderboardEntry.builder()
                .day(DAY)
                .queryId(queryId)
                .queryText("SELECT 1")
                .meanTimeMs(mean)
                .maxTimeMs(mean)
                .totalTimeMs(mean * 10)
                .calls(10)
                .rows(1)
                .sharedBlocksRead(0)
                .sharedBlocksHit(5)
                .lastSeen(lastSeen)
                .build();
    }
}
