package me.golemcore.toolrouter.domain.model;

import java.time.Instant;

/**
 * Aggregate of recorded telemetry for one (tool, pattern).
 */
public record TelemetryStats(String tool, String pattern, long count, long successCount, double meanTimeMs,
        double meanCost, Instant lastTimestamp) {

    public double successRate() {
        return count == 0 ? 0.0 : (double) successCount / count;
    }
}
