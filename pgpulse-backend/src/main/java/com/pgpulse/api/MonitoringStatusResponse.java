package com.pgpulse.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pgpulse.model.ConnectionProfileView;
import lombok.Builder;
import lombok.Data;

/**
 * Response payload that describes whether monitoring is running and against which database.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MonitoringStatusResponse {
    private boolean running;
    private ConnectionProfileView profile;
}
