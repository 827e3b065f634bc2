package com.pgpulse.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Address and credentials of the monitored PostgreSQL database.
 *
 * <p>The same shape is accepted on the REST boundary and written to the monitoring config file.
 * The password is excluded from {@link #toString()} so profiles can be logged safely.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionProfile {
    public static final int DEFAULT_PORT = 5432;

    @NotBlank(message = "host is required")
    private String host;

    @Min(value = 1, message = "port must be between 1 and 65535")
    @Max(value = 65535, message = "port must be between 1 and 65535")
    @Builder.Default
    private int port = DEFAULT_PORT;

    @NotBlank(message = "username is required")
    @JsonAlias("user")
    private String username;

    @ToString.Exclude
    private String password;

    @NotBlank(message = "database is required")
    private String database;

    /**
     * Identifies the monitored database as {@code host:port/database}. Contains no secrets.
     */
    public String targetKey() {
        return host + ":" + port + "/" + database;
    }

    /**
     * Checks the fields required to open a connection. Used where bean validation does not run,
     * e.g. when a profile is read back from disk.
     *
     * @throws IllegalArgumentException if a required field is missing or the port is out of range
     */
    public void validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
    }
}
