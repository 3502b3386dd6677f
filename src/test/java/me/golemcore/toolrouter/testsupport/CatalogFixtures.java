package me.golemcore.toolrouter.testsupport;

import me.golemcore.toolrouter.domain.model.CapabilityBlock;
import me.golemcore.toolrouter.domain.model.ExecutionSpec;
import me.golemcore.toolrouter.domain.model.InputParameter;
import me.golemcore.toolrouter.domain.model.ParameterType;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.PatternPolicy;
import me.golemcore.toolrouter.domain.model.PreferenceMatch;
import me.golemcore.toolrouter.domain.model.ProtocolType;
import me.golemcore.toolrouter.domain.model.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for catalog test data.
 */
public final class CatalogFixtures {

    public static final String SERVICE_RESTART = "service_restart";

    private CatalogFixtures() {
    }

    public static PreferenceMatch match(double speed, double accuracy, double cost, double complexity,
            double completeness) {
        return PreferenceMatch.builder()
                .speed(speed)
                .accuracy(accuracy)
                .cost(cost)
                .complexity(complexity)
                .completeness(completeness)
                .build();
    }

    public static Pattern pattern(String timeEstimateMs, String costEstimate, PreferenceMatch match) {
        return Pattern.builder()
                .description("pattern costing " + costEstimate)
                .timeEstimateMs(timeEstimateMs)
                .costEstimate(costEstimate)
                .complexityScore(0.5)
                .preferenceMatch(match)
                .build();
    }

    public static Pattern pattern(String timeEstimateMs, String costEstimate, PreferenceMatch match,
            PatternPolicy policy) {
        return pattern(timeEstimateMs, costEstimate, match).toBuilder().policy(policy).build();
    }

    public static ToolDefinition tool(String name, String version, String capability,
            Map<String, Pattern> patterns) {
        return ToolDefinition.builder()
                .name(name)
                .version(version)
                .description(name + " tool")
                .platform("linux")
                .category("test")
                .capabilities(Map.of(capability, CapabilityBlock.builder()
                        .description(capability)
                        .patterns(patterns)
                        .build()))
                .build();
    }

    /**
     * A restart tool with a cheap, production-safe in-place restart and an
     * expensive redeploy that needs approval.
     */
    public static ToolDefinition serviceRestartTool() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("systemd_restart", pattern("800", "1", match(0.95, 0.8, 0.95, 0.9, 0.8),
                PatternPolicy.builder().productionSafe(true).maxExecutionTimeMs(30_000L).build())
                .toBuilder()
                .requiredInputs(List.of(InputParameter.builder()
                        .name("service")
                        .type(ParameterType.STRING)
                        .validation("[A-Za-z0-9@._-]+")
                        .build()))
                .build());
        patterns.put("full_redeploy", pattern("45000", "20", match(0.2, 0.95, 0.3, 0.2, 1.0),
                PatternPolicy.builder().requiresApproval(true).productionSafe(false).build()));
        return tool(SERVICE_RESTART, "1.0.0", SERVICE_RESTART, patterns).toBuilder()
                .execution(ExecutionSpec.builder()
                        .executionLocation("ssh")
                        .protocol(ProtocolType.REMOTE_SHELL)
                        .requiresCredentials(true)
                        .protocolMetadata(Map.of("command", "sudo systemctl restart {{service}}"))
                        .build())
                .build();
    }
}
