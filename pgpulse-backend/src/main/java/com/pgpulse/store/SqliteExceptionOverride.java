package com.pgpulse.store;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * HikariCP override that keeps store connections in the pool on transient SQLite lock errors.
 *
 * SQLITE_BUSY (5) and SQLITE_LOCKED (6), including their extended codes, mean another connection
 * holds the write lock. The connection itself is healthy.
 */
public class SqliteExceptionOverride implements SQLExceptionOverride {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        int primaryCode = sqlException.getErrorCode() & 0xff;
        if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
