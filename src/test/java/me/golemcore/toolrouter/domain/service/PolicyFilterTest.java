package me.golemcore.toolrouter.domain.service;

import me.golemcore.toolrouter.domain.exception.NoEligibleCandidateException;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.Candidate;
import me.golemcore.toolrouter.domain.model.PatternPolicy;
import me.golemcore.toolrouter.domain.model.PolicyFilterResult;
import me.golemcore.toolrouter.domain.model.PolicyRejection;
import me.golemcore.toolrouter.domain.model.PolicyViolation;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.domain.model.ToolDefinition;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.toolrouter.testsupport.CatalogFixtures.SERVICE_RESTART;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.match;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.pattern;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.serviceRestartTool;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.tool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyFilterTest {

    private ToolRouterProperties properties;
    private PolicyFilter policyFilter;

    @BeforeEach
    void setUp() {
        properties = new ToolRouterProperties();
        policyFilter = new PolicyFilter(properties);
    }

    @Test
    void shouldKeepEveryCandidateWithoutConstraints() {
        List<Candidate> candidates = candidatesOf(serviceRestartTool());

        PolicyFilterResult result = policyFilter.filter(candidates, request().build());

        assertEquals(candidates, result.eligible());
        assertTrue(result.rejections().isEmpty());
    }

    @Test
    void shouldRemoveUnsafePatternWhenProductionSafeRequired() {
        PolicyFilterResult result = policyFilter.filter(candidatesOf(serviceRestartTool()),
                request().productionSafeOnly(true).build());

        assertEquals(List.of("service_restart.systemd_restart"), keys(result));
        assertEquals(List.of(new PolicyRejection("service_restart.full_redeploy",
                PolicyViolation.NOT_PRODUCTION_SAFE, "pattern is not production safe")), result.rejections());
    }

    @Test
    void shouldApplyConfiguredProductionSafetyWhenRequestIsSilent() {
        properties.getSelection().setRequireProductionSafe(true);

        PolicyFilterResult result = policyFilter.filter(candidatesOf(serviceRestartTool()), request().build());

        assertEquals(List.of("service_restart.systemd_restart"), keys(result));
    }

    @Test
    void shouldRemoveApprovalPatternOnlyWhenApprovalExplicitlyDisallowed() {
        List<Candidate> candidates = candidatesOf(serviceRestartTool());

        assertEquals(2, policyFilter.filter(candidates, request().approvalAllowed(true).build()).eligible().size());
        PolicyFilterResult result = policyFilter.filter(candidates, request().approvalAllowed(false).build());
        assertEquals(PolicyViolation.APPROVAL_NOT_ALLOWED, result.rejections().get(0).violation());
    }

    @Test
    void shouldRejectCostOverBudgetEvaluatedAtN() {
        ToolDefinition scan = tool("scan", "1.0.0", "index", Map.of(
                "linear", pattern("10", "N / 100", match(0.5, 0.5, 0.5, 0.5, 0.5))));
        List<Candidate> candidates = candidatesOf(scan);

        assertEquals(1, policyFilter.filter(candidates, request().capability("index").n(100)
                .budget(new Budget(null, 5.0)).build()).eligible().size());
        PolicyFilterResult result = policyFilter.filter(candidates, request().capability("index").n(1000)
                .budget(new Budget(null, 5.0)).build());
        assertEquals(PolicyViolation.COST_EXCEEDS_BUDGET, result.rejections().get(0).violation());
        assertEquals("cost 10 > budget 5", result.rejections().get(0).detail());
    }

    @Test
    void shouldRejectEverythingWithZeroCostBudget() {
        PolicyFilterResult result = policyFilter.filter(candidatesOf(serviceRestartTool()),
                request().budget(new Budget(null, 0.0)).build());

        NoEligibleCandidateException error = assertThrows(NoEligibleCandidateException.class, result::orElseThrow);
        assertEquals(2, error.getRejections().size());
        assertTrue(error.getRejections().stream()
                .allMatch(r -> r.violation() == PolicyViolation.COST_EXCEEDS_BUDGET));
    }

    @Test
    void shouldNotExcludeOnTimeBudget() {
        PolicyFilterResult result = policyFilter.filter(candidatesOf(serviceRestartTool()),
                request().budget(new Budget(1.0, null)).build());

        assertEquals(2, result.eligible().size());
    }

    @Test
    void shouldEnforcePatternCeilings() {
        ToolDefinition bulk = tool("bulk", "1.0.0", "index", Map.of(
                "costly", pattern("10", "N", match(0.5, 0.5, 0.5, 0.5, 0.5),
                        PatternPolicy.builder().maxCost(50.0).build()),
                "slow", pattern("N * 1000", "1", match(0.5, 0.5, 0.5, 0.5, 0.5),
                        PatternPolicy.builder().maxExecutionTimeMs(60_000L).build())));

        PolicyFilterResult result = policyFilter.filter(candidatesOf(bulk),
                request().capability("index").n(100).build());

        assertTrue(result.eligible().isEmpty());
        assertEquals(List.of(PolicyViolation.COST_EXCEEDS_POLICY_MAX, PolicyViolation.TIME_EXCEEDS_POLICY_MAX),
                result.rejections().stream().map(PolicyRejection::violation).toList());
    }

    @Test
    void shouldRejectCostModelThatCannotBeEvaluated() {
        ToolDefinition broken = tool("broken", "1.0.0", "index", Map.of(
                "divide", pattern("10", "100 / N", match(0.5, 0.5, 0.5, 0.5, 0.5))));

        PolicyFilterResult result = policyFilter.filter(candidatesOf(broken),
                request().capability("index").n(0).build());

        assertEquals(PolicyViolation.INVALID_COST_MODEL, result.rejections().get(0).violation());
    }

    @Test
    void shouldPreserveInputOrder() {
        List<Candidate> candidates = candidatesOf(serviceRestartTool());
        List<Candidate> reversed = List.of(candidates.get(1), candidates.get(0));

        assertEquals(reversed, policyFilter.filter(reversed, request().build()).eligible());
    }

    private static SelectionRequest.SelectionRequestBuilder request() {
        return SelectionRequest.builder().capability(SERVICE_RESTART);
    }

    private static List<Candidate> candidatesOf(ToolDefinition tool) {
        return CatalogService.buildCandidates(List.of(tool), tool.getCapabilities().keySet().iterator().next(),
                null);
    }

    private static List<String> keys(PolicyFilterResult result) {
        return result.eligible().stream().map(Candidate::key).toList();
    }
}
