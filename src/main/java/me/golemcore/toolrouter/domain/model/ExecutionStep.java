package me.golemcore.toolrouter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A step before enrichment: an identifier, its inputs, the host it targets,
 * and the ids of earlier steps whose output it depends on.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionStep {

    String id;
    String targetHost;

    @Builder.Default
    Map<String, Object> inputs = Map.of();

    @Builder.Default
    List<String> dependsOn = List.of();
}
