package com.pgpulse.collector;

/**
 * Introspection SQL issued against the monitored database.
 */
final class PgStatQueries {

    static final String SYSTEM_METRICS = """
            SELECT
              (SELECT count(*) FROM pg_stat_activity) AS active_connections,
              (SELECT coalesce(sum(xact_commit + xact_rollback), 0) FROM pg_stat_database) AS total_transactions,
              (SELECT sum(blks_hit)::float8 / NULLIF(sum(blks_hit) + sum(blks_read), 0) FROM pg_stat_database) AS cache_hit_ratio,
              pg_database_size(current_database()) AS db_size_bytes""";

    static final String TOP_STATEMENTS = """
            SELECT
              queryid::text AS queryid,
              query,
              calls,
              total_exec_time,
              mean_exec_time,
              rows,
              shared_blks_read,
              shared_blks_hit
            FROM pg_stat_statements
            ORDER BY mean_exec_time DESC
            LIMIT ?""";

    static final String EXTENSION_INSTALLED =
            "SELECT 1 FROM pg_extension WHERE extname = 'pg_stat_statements'";

    static final String RESET_STATEMENTS = "SELECT pg_stat_statements_reset()";

    // undefined_table: pg_stat_statements view is absent
    static final String SQLSTATE_UNDEFINED_TABLE = "42P01";

    private PgStatQueries() {
    }
}
