package me.golemcore.toolrouter.domain.model;

/**
 * Hint to the caller about how the selected pattern should be run.
 */
public enum ExecutionMode {
    IMMEDIATE, BACKGROUND, APPROVAL_REQUIRED
}
