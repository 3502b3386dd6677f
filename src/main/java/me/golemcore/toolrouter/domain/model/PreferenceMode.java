package me.golemcore.toolrouter.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named weight presets a caller may pass instead of explicit weights.
 */
public enum PreferenceMode {

    FAST(0.55, 0.15, 0.1, 0.1, 0.1),
    ACCURATE(0.1, 0.55, 0.1, 0.1, 0.15),
    THOROUGH(0.05, 0.2, 0.05, 0.1, 0.6),
    CHEAP(0.1, 0.1, 0.6, 0.1, 0.1),
    SIMPLE(0.15, 0.1, 0.1, 0.55, 0.1),
    BALANCED(0.2, 0.2, 0.2, 0.2, 0.2);

    private final PreferenceWeights weights;

    PreferenceMode(double speed, double accuracy, double cost, double complexity, double completeness) {
        this.weights = new PreferenceWeights(speed, accuracy, cost, complexity, completeness);
    }

    public PreferenceWeights weights() {
        return weights;
    }

    @JsonCreator
    public static PreferenceMode fromValue(String value) {
        return PreferenceMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
