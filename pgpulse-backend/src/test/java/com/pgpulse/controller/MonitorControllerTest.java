package com.pgpulse.controller;

import com.pgpulse.collector.CollectionException;
import com.pgpulse.collector.MetricsCollector;
import com.pgpulse.collector.StatementsExtensionMissingException;
import com.pgpulse.model.ConnectionProfile;
import com.pgpulse.model.ConnectionProfileView;
import com.pgpulse.model.DailyLeaderboardEntry;
import com.pgpulse.model.QueryStatCandidate;
import com.pgpulse.model.SystemMetricSample;
import com.pgpulse.monitor.MonitoringScheduler;
import com.pgpulse.service.HistoryService;
import com.pgpulse.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("MonitorController Tests")
class MonitorControllerTest {

    private static final String PROFILE_JSON = """
            {"host":"db.internal","port":5433,"username":"postgres","password":"s3cret","database":"app"}
            """;

    private MonitoringScheduler scheduler;
    private HistoryService historyService;
    private MetricsCollector metricsCollector;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        scheduler = mock(MonitoringScheduler.class);
        historyService = mock(HistoryService.class);
        metricsCollector = mock(MetricsCollector.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MonitorController(scheduler, historyService, metricsCollector))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Start passes the parsed profile to the scheduler")
    void startMonitoring() throws Exception {
        mockMvc.perform(post("/api/monitoring/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("RUNNING"));

        ArgumentCaptor<ConnectionProfile> captor = ArgumentCaptor.forClass(ConnectionProfile.class);
        verify(scheduler).start(captor.capture());
        assertThat(captor.getValue().getHost()).isEqualTo("db.internal");
        assertThat(captor.getValue().getPort()).isEqualTo(5433);
        assertThat(captor.getValue().getPassword()).isEqualTo("s3cret");
    }

    @Test
    @DisplayName("Start accepts the legacy user field and defaults the port")
    void startWithLegacyUserField() throws Exception {
        mockMvc.perform(post("/api/monitoring/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\":\"localhost\",\"user\":\"postgres\",\"password\":\"x\",\"database\":\"app\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<ConnectionProfile> captor = ArgumentCaptor.forClass(ConnectionProfile.class);
        verify(scheduler).start(captor.capture());
        assertThat(captor.getValue().getUsername()).isEqualTo("postgres");
        assertThat(captor.getValue().getPort()).isEqualTo(ConnectionProfile.DEFAULT_PORT);
    }

    @Test
    @DisplayName("Start with missing fields is rejected before reaching the scheduler")
    void startValidationFailure() throws Exception {
        mockMvc.perform(post("/api/monitoring/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\":\"\",\"port\":70000,\"database\":\"app\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details", containsString("host")))
                .andExpect(jsonPath("$.details", containsString("port")));

        verify(scheduler, never()).start(any());
    }

    @Test
    @DisplayName("Start with a malformed body is rejected")
    void startMalformedBody() throws Exception {
        mockMvc.perform(post("/api/monitoring/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST_BODY"));
    }

    @Test
    @DisplayName("Stop always succeeds")
    void stopMonitoring() throws Exception {
        mockMvc.perform(post("/api/monitoring/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("STOPPED"));

        verify(scheduler).stop();
    }

    @Test
    @DisplayName("Status returns the redacted profile in snake_case")
    void statusIsRedacted() throws Exception {
        ConnectionProfileView view = ConnectionProfileView.builder()
                .host("db.internal").port(5433).username("postgres").database("app").build();
        when(scheduler.status()).thenReturn(new MonitoringScheduler.Status(true, view));

        mockMvc.perform(get("/api/monitoring/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.profile.host").value("db.internal"))
                .andExpect(jsonPath("$.profile.username").value("postgres"))
                .andExpect(jsonPath("$.profile.password").doesNotExist())
                .andExpect(content().string(not(containsString("s3cret"))));
    }

    @Test
    @DisplayName("Status while stopped has no profile")
    void statusWhenStopped() throws Exception {
        when(scheduler.status()).thenReturn(new MonitoringScheduler.Status(false, null));

        mockMvc.perform(get("/api/monitoring/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.profile").isEmpty());
    }

    @Test
    @DisplayName("Metrics honour window_minutes and use the default window otherwise")
    void recentMetrics() throws Exception {
        SystemMetricSample sample = SystemMetricSample.builder()
                .timestamp(1_000L).activeConnections(3).cacheHitRatio(0.5).dbSizeBytes(1024L).build();
        when(historyService.recentMetrics(Duration.ofMinutes(15))).thenReturn(List.of(sample));

        mockMvc.perform(get("/api/monitoring/metrics").param("window_minutes", "15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].active_connections").value(3))
                .andExpect(jsonPath("$[0].cache_hit_ratio").value(0.5))
                .andExpect(jsonPath("$[0].db_size_bytes").value(1024));

        mockMvc.perform(get("/api/monitoring/metrics"))
                .andExpect(status().isOk());
        verify(historyService).recentMetrics(isNull());
    }

    @Test
    @DisplayName("A non-positive metrics window is a bad request")
    void recentMetricsInvalidWindow() throws Exception {
        when(historyService.recentMetrics(Duration.ofMinutes(0)))
                .thenThrow(new IllegalArgumentException("metrics window must be positive"));

        mockMvc.perform(get("/api/monitoring/metrics").param("window_minutes", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Daily top lists today's entries")
    void dailyTop() throws Exception {
        DailyLeaderboardEntry entry = DailyLeaderboardEntry.builder()
                .day(LocalDate.of(2024, 5, 10))
                .queryId("42")
                .queryText("SELECT 1")
                .meanTimeMs(12.5)
                .maxTimeMs(20.0)
                .calls(7)
                .build();
        when(historyService.todayLeaderboard()).thenReturn(List.of(entry));

        mockMvc.perform(get("/api/history/daily-top"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].query_id").value("42"))
                .andExpect(jsonPath("$[0].mean_time_ms").value(12.5))
                .andExpect(jsonPath("$[0].max_time_ms").value(20.0));
    }

    @Test
    @DisplayName("Live catalogue returns the collector's candidates")
    void liveStatements() throws Exception {
        QueryStatCandidate candidate = QueryStatCandidate.builder()
                .queryId("7").queryText("SELECT pg_sleep(1)").calls(2).meanTimeMs(1000.0).build();
        when(metricsCollector.fetchLiveCatalogue(any())).thenReturn(List.of(candidate));

        mockMvc.perform(post("/api/pg-stat-statements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].query_id").value("7"))
                .andExpect(jsonPath("$[0].mean_time_ms").value(1000.0));
    }

    @Test
    @DisplayName("Missing pg_stat_statements maps to EXTENSION_MISSING")
    void liveStatementsExtensionMissing() throws Exception {
        when(metricsCollector.fetchLiveCatalogue(any()))
                .thenThrow(new StatementsExtensionMissingException("pg_stat_statements extension is not installed"));

        mockMvc.perform(post("/api/pg-stat-statements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EXTENSION_MISSING"));
    }

    @Test
    @DisplayName("Target connection failures map to 502")
    void resetTargetFailure() throws Exception {
        doThrow(new CollectionException("Failed to connect to db.internal:5433/app"))
                .when(metricsCollector).resetStatistics(any());

        mockMvc.perform(post("/api/pg-stat-statements/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("TARGET_DATABASE_ERROR"))
                .andExpect(content().string(not(containsString("s3cret"))));
    }

    @Test
    @DisplayName("Reset reports success")
    void resetStatements() throws Exception {
        mockMvc.perform(post("/api/pg-stat-statements/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(metricsCollector).resetStatistics(any());
    }
}
