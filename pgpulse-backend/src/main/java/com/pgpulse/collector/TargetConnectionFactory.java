package com.pgpulse.collector;

import com.pgpulse.model.ConnectionProfile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens unpooled connections to the monitored database. Every caller owns the returned
 * connection and must close it.
 */
@Component
public class TargetConnectionFactory {

    static final String APPLICATION_NAME = "pgpulse";

    private final int connectTimeoutSec;
    private final int socketTimeoutSec;

    public TargetConnectionFactory(
            @Value("${pgpulse.target.connect-timeout-sec:10}") int connectTimeoutSec,
            @Value("${pgpulse.target.socket-timeout-sec:30}") int socketTimeoutSec
    ) {
        this.connectTimeoutSec = connectTimeoutSec;
        this.socketTimeoutSec = socketTimeoutSec;
    }

    /**
     * Opens a new connection for {@code profile}.
     *
     * @param profile connection profile
     * @return an open connection
     * @throws SQLException if the connection cannot be established
     */
    public Connection open(ConnectionProfile profile) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", profile.getUsername());
        if (profile.getPassword() != null) {
            props.setProperty("password", profile.getPassword());
        }
        // Shows up as pg_stat_activity.application_name on the target.
        props.setProperty("ApplicationName", APPLICATION_NAME);
        props.setProperty("connectTimeout", String.valueOf(connectTimeoutSec));
        props.setProperty("socketTimeout", String.valueOf(socketTimeoutSec));
        props.setProperty("ssl", "false");
        return DriverManager.getConnection(buildJdbcUrl(profile), props);
    }

    /**
     * Builds the PostgreSQL JDBC URL for {@code profile}.
     *
     * @param profile connection profile
     * @return jdbc url
     */
    public static String buildJdbcUrl(ConnectionProfile profile) {
        int port = profile.getPort() > 0 ? profile.getPort() : ConnectionProfile.DEFAULT_PORT;
        return String.format("jdbc:postgresql://%s:%d/%s", profile.getHost(), port, profile.getDatabase());
    }
}
