package me.golemcore.toolrouter.domain.service;

import me.golemcore.toolrouter.domain.model.InputParameter;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.PatternPolicy;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.toolrouter.testsupport.CatalogFixtures.match;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.pattern;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.serviceRestartTool;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.tool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolDefinitionValidatorTest {

    private final ToolDefinitionValidator validator = new ToolDefinitionValidator();

    @Test
    void shouldAcceptWellFormedDefinition() {
        ToolDefinitionValidator.Validation validation = validator.validate(serviceRestartTool());

        assertTrue(validation.isValid(), () -> validation.violations().toString());
        assertTrue(validation.warnings().isEmpty());
    }

    @Test
    void shouldCollectEveryIdentityViolation() {
        ToolDefinition tool = serviceRestartTool().toBuilder()
                .name("bad name")
                .version("1.0")
                .platform("")
                .build();

        List<String> violations = validator.validate(tool).violations();

        assertEquals(3, violations.size());
        assertTrue(violations.get(1).contains("'1.0' is not a semantic version"));
    }

    @Test
    void shouldRejectDecreasingCostModel() {
        ToolDefinition tool = tool("sampler", "1.0.0", "estimate", Map.of(
                "shrinking", pattern("1000 - N", "1", match(0.5, 0.5, 0.5, 0.5, 0.5))));

        List<String> violations = validator.validate(tool).violations();

        assertFalse(violations.isEmpty());
        assertTrue(violations.stream().allMatch(v -> v.startsWith("estimate.shrinking.timeEstimateMs: ")));
    }

    @Test
    void shouldRejectUnparseableAndNegativeExpressions() {
        ToolDefinition tool = tool("calc", "1.0.0", "estimate", Map.of(
                "broken", pattern("N *", "-5", match(0.5, 0.5, 0.5, 0.5, 0.5))));

        List<String> violations = validator.validate(tool).violations();

        assertEquals(2, violations.size());
        assertTrue(violations.get(0).startsWith("estimate.broken.timeEstimateMs: Unexpected end"));
        assertTrue(violations.get(1).contains("'-5' is negative at N=0"));
    }

    @Test
    void shouldRequirePreferenceMatchWithinUnitRange() {
        Pattern missing = pattern("1", "1", null);
        Pattern outOfRange = pattern("1", "1", match(1.5, 0.5, -0.1, 0.5, 0.5));
        ToolDefinition tool = tool("pm", "1.0.0", "cap", Map.of("missing", missing, "range", outOfRange));

        List<String> violations = validator.validate(tool).violations();

        assertTrue(violations.contains("cap.missing: preferenceMatch is required"));
        assertTrue(violations.contains("cap.range: preferenceMatch.speed must be within [0,1]"));
        assertTrue(violations.contains("cap.range: preferenceMatch.cost must be within [0,1]"));
    }

    @Test
    void shouldValidatePolicyAndInputs() {
        Pattern p = pattern("1", "1", match(0.5, 0.5, 0.5, 0.5, 0.5),
                PatternPolicy.builder().maxCost(-1.0).maxExecutionTimeMs(0L).build()).toBuilder()
                .requiredInputs(List.of(
                        InputParameter.builder().name("host").build(),
                        InputParameter.builder().name("host").validation("[a-z").build()))
                .optionalInputs(List.of(InputParameter.builder().name(" ").build()))
                .build();

        List<String> violations = validator.validate(tool("t", "1.0.0", "cap", Map.of("p", p))).violations();

        assertEquals(5, violations.size());
        assertTrue(violations.contains("cap.p: policy.maxCost must not be negative"));
        assertTrue(violations.contains("cap.p: policy.maxExecutionTimeMs must be positive"));
        assertTrue(violations.contains("cap.p: input 'host' is declared twice"));
        assertTrue(violations.contains("cap.p: input names must not be blank"));
    }

    @Test
    void shouldRequireCapabilitiesAndPatterns() {
        ToolDefinition empty = serviceRestartTool().toBuilder().capabilities(Map.of()).build();
        ToolDefinition noPatterns = tool("t", "1.0.0", "cap", Map.of());

        assertEquals(List.of("at least one capability is required"), validator.validate(empty).violations());
        assertEquals(List.of("cap: at least one pattern is required"), validator.validate(noPatterns).violations());
    }

    @Test
    void shouldWarnAboutMissingDescriptions() {
        Pattern undocumented = pattern("1", "1", match(0.5, 0.5, 0.5, 0.5, 0.5)).toBuilder()
                .description(null).build();
        ToolDefinition tool = tool("t", "1.0.0", "cap", Map.of("p", undocumented)).toBuilder()
                .description(null).build();

        ToolDefinitionValidator.Validation validation = validator.validate(tool);

        assertTrue(validation.isValid());
        assertEquals(List.of("tool has no description", "cap.p: pattern has no description"),
                validation.warnings());
    }
}
