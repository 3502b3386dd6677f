package me.golemcore.toolrouter.adapter.inbound.web.controller;

import me.golemcore.toolrouter.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.toolrouter.domain.model.TelemetryRecord;
import me.golemcore.toolrouter.domain.model.TelemetryStats;
import me.golemcore.toolrouter.domain.service.TelemetryRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelemetryControllerTest {

    private TelemetryRecorder telemetryRecorder;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        telemetryRecorder = mock(TelemetryRecorder.class);
        webTestClient = WebTestClient.bindToController(new TelemetryController(telemetryRecorder))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldAcceptTelemetryRecord() {
        when(telemetryRecorder.record(any(TelemetryRecord.class))).thenReturn(true);

        webTestClient.post()
                .uri("/api/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tool\":\"log_search\",\"pattern\":\"grep\",\"observedTimeMs\":350,"
                        + "\"observedCost\":0.2,\"success\":true}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(true);

        ArgumentCaptor<TelemetryRecord> captor = ArgumentCaptor.forClass(TelemetryRecord.class);
        verify(telemetryRecorder).record(captor.capture());
        assertEquals("grep", captor.getValue().getPattern());
        assertEquals(350.0, captor.getValue().getObservedTimeMs());
        assertTrue(captor.getValue().isSuccess());
    }

    @Test
    void shouldReportDisabledRecorder() {
        when(telemetryRecorder.record(any(TelemetryRecord.class))).thenReturn(false);

        webTestClient.post()
                .uri("/api/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tool\":\"log_search\",\"pattern\":\"grep\",\"observedTimeMs\":1}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(false);
    }

    @Test
    void shouldFilterStatsByToolAndPattern() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        when(telemetryRecorder.getStats()).thenReturn(List.of(
                new TelemetryStats("log_search", "grep", 4, 3, 200.0, 0.1, now),
                new TelemetryStats("log_search", "elastic", 2, 2, 80.0, 0.5, now),
                new TelemetryStats("service_restart", "systemd_restart", 1, 1, 900.0, 1.0, now)));

        webTestClient.get()
                .uri("/api/telemetry/stats?tool=log_search")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);

        webTestClient.get()
                .uri("/api/telemetry/stats?tool=log_search&pattern=elastic")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].meanTimeMs").isEqualTo(80.0);
    }
}
