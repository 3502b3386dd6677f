package me.golemcore.toolrouter.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the dispatcher does when a step fails.
 */
public enum FailurePolicy {

    /** Stop at the first failed step; remaining steps are skipped. */
    ABORT_ON_FIRST_FAILURE("abort-on-first-failure"),

    /** Run every step whose dependencies succeeded and collect all results. */
    CONTINUE_AND_COLLECT("continue-and-collect");

    private final String value;

    FailurePolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FailurePolicy fromValue(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (FailurePolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown failure policy: " + raw);
    }
}
