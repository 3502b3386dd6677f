package me.golemcore.toolrouter.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a pattern returns the exact answer or an approximation of it.
 */
public enum Completeness {
    EXACT, APPROXIMATE;

    @JsonCreator
    public static Completeness fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "exact", "complete", "full" -> EXACT;
        case "approximate", "partial", "sampled", "estimate" -> APPROXIMATE;
        default -> throw new IllegalArgumentException("Unknown completeness: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
