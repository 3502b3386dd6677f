package me.golemcore.toolrouter.domain.model;

/**
 * Terminal state of a dispatched step.
 */
public enum StepStatus {
    SUCCEEDED, FAILED, TIMED_OUT, CANCELLED, SKIPPED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
