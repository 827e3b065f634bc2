package com.pgpulse.config;

import com.pgpulse.store.SqliteExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Snapshot store wiring.
 *
 * The store lives in an embedded SQLite file under the data directory. A small Hikari pool lets
 * status and leaderboard reads proceed while a sampling cycle is writing.
 */
@Slf4j
@Configuration
public class StoreConfig {

    public static final String DATABASE_FILE = "app.db";

    @Bean(destroyMethod = "close")
    public HikariDataSource snapshotDataSource(
            @Value("${pgpulse.data-dir:data}") String dataDir,
            @Value("${pgpulse.store.pool-size:4}") int poolSize
    ) {
        Path dir = Paths.get(dataDir);
        HikariDataSource ds = createDataSource(dir, poolSize);
        log.info("Snapshot store opened: path={}", dir.resolve(DATABASE_FILE).toAbsolutePath());
        return ds;
    }

    @Bean
    public JdbcTemplate snapshotJdbcTemplate(HikariDataSource snapshotDataSource) {
        return new JdbcTemplate(snapshotDataSource);
    }

    /**
     * Builds the pooled data source over {@code <dataDir>/app.db}, creating the directory if needed.
     *
     * @param dataDir data directory
     * @param poolSize maximum pool size
     * @return data source
     */
    public static HikariDataSource createDataSource(Path dataDir, int poolSize) {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create data directory: " + dataDir, e);
        }

        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(SqliteExceptionOverride.class.getName());
        config.setJdbcUrl("jdbc:sqlite:" + dataDir.resolve(DATABASE_FILE).toAbsolutePath());
        config.setDriverClassName("org.sqlite.JDBC");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", "5000");
        config.setMaximumPoolSize(Math.max(1, poolSize));
        config.setMinimumIdle(1);
        config.setPoolName("pgpulse-store");
        return new HikariDataSource(config);
    }
}
