package me.golemcore.toolrouter.domain.service;

import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry hint for cold-key outages: the base delay, doubled for each consecutive
 * outage, capped at the configured maximum. A successful store read resets it.
 */
@Component
public class RetryAfterPolicy {

    private static final int MAX_DOUBLINGS = 20;

    private final long baseSeconds;
    private final long maxSeconds;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public RetryAfterPolicy(ToolRouterProperties properties) {
        this.baseSeconds = Math.max(1, properties.getSelection().getRetryAfterBaseSeconds());
        this.maxSeconds = Math.max(baseSeconds, properties.getSelection().getRetryAfterMaxSeconds());
    }

    /**
     * Records an outage and returns the hint, always at least one second.
     */
    public long nextRetryAfterSeconds() {
        int failures = consecutiveFailures.getAndIncrement();
        long delay = baseSeconds << Math.min(failures, MAX_DOUBLINGS);
        return Math.min(delay, maxSeconds);
    }

    public void reset() {
        consecutiveFailures.set(0);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
