package me.golemcore.toolrouter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a catalog import or dry run.
 */
@Value
@Builder
public class ImportReport {

    /**
     * What the import did with the submitted definition.
     */
    public enum Outcome {
        VALIDATED, CREATED, UNCHANGED
    }

    String toolName;
    String version;
    boolean dryRun;
    Outcome outcome;

    @Builder.Default
    List<String> warnings = List.of();
}
