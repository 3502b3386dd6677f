package me.golemcore.toolrouter.domain.model;

import lombok.Value;

/**
 * A (tool, pattern) pair eligible for a capability request.
 */
@Value
public class Candidate {

    ToolDefinition tool;
    String capability;
    String patternName;
    Pattern pattern;

    /**
     * Stable identifier used as the secondary sort key and in tie-break prompts.
     */
    public String key() {
        return tool.getName() + "." + patternName;
    }
}
