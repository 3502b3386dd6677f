package me.golemcore.toolrouter.domain.model;

import java.util.List;

/**
 * Required and optional inputs of the selected pattern.
 */
public record InputContract(List<InputParameter> required, List<InputParameter> optional) {

    public static InputContract of(Pattern pattern) {
        return new InputContract(List.copyOf(pattern.getRequiredInputs()), List.copyOf(pattern.getOptionalInputs()));
    }
}
