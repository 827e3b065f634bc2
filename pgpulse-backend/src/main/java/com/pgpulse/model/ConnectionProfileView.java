package com.pgpulse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@link ConnectionProfile} without its secret fields, safe to return to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionProfileView {
    private String host;
    private int port;
    private String username;
    private String database;

    public static ConnectionProfileView of(ConnectionProfile profile) {
        if (profile == null) {
            return null;
        }
        return ConnectionProfileView.builder()
                .host(profile.getHost())
                .port(profile.getPort())
                .username(profile.getUsername())
                .database(profile.getDatabase())
                .build();
    }
}
