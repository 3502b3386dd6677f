package me.golemcore.toolrouter.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.TelemetryRecord;
import me.golemcore.toolrouter.domain.model.TelemetryStats;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Append-only recorder of observed (tool, pattern) outcomes.
 *
 * <p>
 * Features:
 * <ul>
 * <li>In-memory aggregate per (tool, pattern) updated on the caller's
 * thread</li>
 * <li>Persistence to daily JSONL files in the {@code telemetry/} storage
 * directory, written by a single background thread behind a bounded
 * queue</li>
 * <li>Reload of persisted records within the retention window on startup</li>
 * </ul>
 *
 * <p>
 * A full queue drops the persistence write (never the caller's request) and
 * logs a warning. Can be disabled via {@code toolrouter.telemetry.enabled}.
 */
@Service
@Slf4j
public class TelemetryRecorder {

    private static final String TELEMETRY_DIR = "telemetry";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ToolRouterProperties.TelemetryProperties config;
    private final Clock clock;
    private final Map<String, Accumulator> aggregates = new ConcurrentHashMap<>();

    private ThreadPoolExecutor persistExecutor;

    public TelemetryRecorder(StoragePort storagePort, ObjectMapper objectMapper, ToolRouterProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.config = properties.getTelemetry();
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        persistExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, config.getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "telemetry-writer");
                    t.setDaemon(true);
                    return t;
                },
                (task, executor) -> log.warn("[Telemetry] Write queue full, dropping a persisted record"));
        loadPersisted();
    }

    @PreDestroy
    void destroy() {
        if (persistExecutor == null) {
            return;
        }
        persistExecutor.shutdown();
        try {
            persistExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Records one observation. A missing timestamp is set to now.
     *
     * @return false if telemetry is disabled
     * @throws InvalidRequestException
     *             if the record is malformed
     */
    public boolean record(TelemetryRecord telemetry) {
        if (!config.isEnabled()) {
            return false;
        }
        validate(telemetry);
        TelemetryRecord stamped = telemetry.getTimestamp() != null
                ? telemetry
                : TelemetryRecord.builder()
                        .tool(telemetry.getTool())
                        .pattern(telemetry.getPattern())
                        .observedTimeMs(telemetry.getObservedTimeMs())
                        .observedCost(telemetry.getObservedCost())
                        .success(telemetry.isSuccess())
                        .timestamp(clock.instant())
                        .build();

        index(stamped);
        if (persistExecutor != null) {
            persistExecutor.execute(() -> persist(stamped));
        }
        log.debug("[Telemetry] Recorded {}.{}: {}ms, cost {}, success={}", stamped.getTool(), stamped.getPattern(),
                stamped.getObservedTimeMs(), stamped.getObservedCost(), stamped.isSuccess());
        return true;
    }

    /**
     * Aggregates for every (tool, pattern), ordered by tool then pattern.
     */
    public List<TelemetryStats> getStats() {
        List<TelemetryStats> stats = new ArrayList<>();
        for (Accumulator accumulator : aggregates.values()) {
            stats.add(accumulator.toStats());
        }
        stats.sort(Comparator.comparing(TelemetryStats::tool).thenComparing(TelemetryStats::pattern));
        return stats;
    }

    public Optional<TelemetryStats> getStats(String tool, String pattern) {
        return Optional.ofNullable(aggregates.get(key(tool, pattern))).map(Accumulator::toStats);
    }

    private void validate(TelemetryRecord telemetry) {
        List<String> problems = new ArrayList<>();
        if (telemetry.getTool() == null || telemetry.getTool().isBlank()) {
            problems.add("tool is required");
        }
        if (telemetry.getPattern() == null || telemetry.getPattern().isBlank()) {
            problems.add("pattern is required");
        }
        if (telemetry.getObservedTimeMs() < 0 || Double.isNaN(telemetry.getObservedTimeMs())) {
            problems.add("observedTimeMs must be >= 0");
        }
        if (telemetry.getObservedCost() < 0 || Double.isNaN(telemetry.getObservedCost())) {
            problems.add("observedCost must be >= 0");
        }
        if (!problems.isEmpty()) {
            throw new InvalidRequestException("Invalid telemetry record: " + String.join("; ", problems), problems);
        }
    }

    private void index(TelemetryRecord telemetry) {
        aggregates.computeIfAbsent(key(telemetry.getTool(), telemetry.getPattern()),
                k -> new Accumulator(telemetry.getTool(), telemetry.getPattern()))
                .add(telemetry);
    }

    private void persist(TelemetryRecord telemetry) {
        try {
            String file = LocalDate.ofInstant(telemetry.getTimestamp(), ZoneOffset.UTC) + JSONL_EXTENSION;
            String json = objectMapper.writeValueAsString(telemetry) + NEWLINE;
            storagePort.appendText(TELEMETRY_DIR, file, json).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Telemetry] Failed to persist record for {}.{}: {}", telemetry.getTool(),
                    telemetry.getPattern(), e.getMessage());
        }
    }

    private void loadPersisted() {
        if (!config.isEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(config.getRetention());
        try {
            List<String> files = storagePort.listObjects(TELEMETRY_DIR, "").join();
            if (files == null || files.isEmpty()) {
                log.debug("[Telemetry] No persisted telemetry found");
                return;
            }
            int loaded = 0;
            int skippedOld = 0;
            for (String file : files) {
                if (!file.endsWith(JSONL_EXTENSION)) {
                    continue;
                }
                String content = storagePort.getText(TELEMETRY_DIR, file).join();
                if (content == null || content.isBlank()) {
                    continue;
                }
                for (String line : content.split(NEWLINE)) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        TelemetryRecord telemetry = objectMapper.readValue(line, TelemetryRecord.class);
                        if (telemetry.getTimestamp() != null && telemetry.getTimestamp().isBefore(cutoff)) {
                            skippedOld++;
                            continue;
                        }
                        index(telemetry);
                        loaded++;
                    } catch (JsonProcessingException e) {
                        log.debug("[Telemetry] Skipping malformed line in {}: {}", file, e.getMessage());
                    }
                }
            }
            log.info("[Telemetry] Loaded {} records from storage (skipped {} beyond {}d retention)", loaded,
                    skippedOld, config.getRetention().toDays());
        } catch (RuntimeException e) {
            log.warn("[Telemetry] Failed to load persisted telemetry: {}", e.getMessage());
        }
    }

    private static String key(String tool, String pattern) {
        return tool + "." + pattern;
    }

    /**
     * Running totals for one (tool, pattern).
     */
    private static final class Accumulator {

        private final String tool;
        private final String pattern;
        private long count;
        private long successCount;
        private double totalTimeMs;
        private double totalCost;
        private Instant lastTimestamp;

        Accumulator(String tool, String pattern) {
            this.tool = tool;
            this.pattern = pattern;
        }

        synchronized void add(TelemetryRecord telemetry) {
            count++;
            if (telemetry.isSuccess()) {
                successCount++;
            }
            totalTimeMs += telemetry.getObservedTimeMs();
            totalCost += telemetry.getObservedCost();
            if (lastTimestamp == null
                    || (telemetry.getTimestamp() != null && telemetry.getTimestamp().isAfter(lastTimestamp))) {
                lastTimestamp = telemetry.getTimestamp();
            }
        }

        synchronized TelemetryStats toStats() {
            return new TelemetryStats(tool, pattern, count, successCount,
                    count == 0 ? 0.0 : totalTimeMs / count,
                    count == 0 ? 0.0 : totalCost / count,
                    lastTimestamp);
        }
    }
}
