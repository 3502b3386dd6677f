package me.golemcore.toolrouter.domain.model;

/**
 * Overall outcome of a dispatched plan.
 */
public enum PlanStatus {
    RUNNING, SUCCEEDED, PARTIAL, FAILED, CANCELLED, TIMED_OUT
}
