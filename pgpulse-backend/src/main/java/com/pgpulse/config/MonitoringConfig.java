package com.pgpulse.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class MonitoringConfig {

    /**
     * Clock used for sample timestamps and leaderboard day keys. The zone decides where "today"
     * starts and ends; blank means the host's default zone.
     */
    @Bean
    public Clock monitoringClock(@Value("${pgpulse.monitoring.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone.trim()));
    }
}
