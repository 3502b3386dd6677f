package me.golemcore.toolrouter.domain.model;

/**
 * Latency class derived from the modeled execution time.
 */
public enum SlaClass {
    INTERACTIVE, BATCH, BACKGROUND
}
