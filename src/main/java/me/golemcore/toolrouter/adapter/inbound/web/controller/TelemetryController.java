package me.golemcore.toolrouter.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.TelemetryRecord;
import me.golemcore.toolrouter.domain.model.TelemetryStats;
import me.golemcore.toolrouter.domain.service.TelemetryRecorder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Telemetry ingestion and per-pattern statistics.
 */
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final TelemetryRecorder telemetryRecorder;

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> ingest(@RequestBody(required = false) TelemetryRecord record) {
        if (record == null) {
            return Mono.error(new InvalidRequestException("Request body is required"));
        }
        boolean accepted = telemetryRecorder.record(record);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted)));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<List<TelemetryStats>>> stats(@RequestParam(required = false) String tool,
            @RequestParam(required = false) String pattern) {
        List<TelemetryStats> stats = telemetryRecorder.getStats().stream()
                .filter(s -> tool == null || tool.equals(s.tool()))
                .filter(s -> pattern == null || pattern.equals(s.pattern()))
                .toList();
        return Mono.just(ResponseEntity.ok(stats));
    }
}
