package me.golemcore.toolrouter.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolrouter.adapter.outbound.tiebreak.FirstCandidateTieBreakJudge;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.exception.NoEligibleCandidateException;
import me.golemcore.toolrouter.domain.exception.ServiceUnavailableException;
import me.golemcore.toolrouter.domain.model.Budget;
import me.golemcore.toolrouter.domain.model.ExecutionMode;
import me.golemcore.toolrouter.domain.model.Pattern;
import me.golemcore.toolrouter.domain.model.PolicyViolation;
import me.golemcore.toolrouter.domain.model.PreferenceWeights;
import me.golemcore.toolrouter.domain.model.ProtocolType;
import me.golemcore.toolrouter.domain.model.ResultSource;
import me.golemcore.toolrouter.domain.model.SelectionMethod;
import me.golemcore.toolrouter.domain.model.SelectionOutcome;
import me.golemcore.toolrouter.domain.model.SelectionRequest;
import me.golemcore.toolrouter.domain.model.SelectionResult;
import me.golemcore.toolrouter.domain.model.SlaClass;
import me.golemcore.toolrouter.domain.model.TieBreakResolution;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.CatalogStorePort;
import me.golemcore.toolrouter.port.outbound.TieBreakJudgePort;
import me.golemcore.toolrouter.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.toolrouter.testsupport.CatalogFixtures.SERVICE_RESTART;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.match;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.pattern;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.serviceRestartTool;
import static me.golemcore.toolrouter.testsupport.CatalogFixtures.tool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SelectionServiceTest {

    private static final String PING = "ping";

    private CatalogStorePort store;
    private MutableClock clock;
    private ToolRouterProperties properties;
    private CatalogService catalogService;
    private ScoringEngine scoringEngine;
    private TieBreakJudgePort llmJudge;
    private SelectionService selectionService;

    @BeforeEach
    void setUp() {
        store = mock(CatalogStorePort.class);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ToolRouterProperties();
        properties.getSelection().setCacheTtl(Duration.ofSeconds(60));
        properties.getSelection().setStaleGrace(Duration.ofMinutes(10));
        properties.getCatalog().setCacheTtl(Duration.ofMinutes(5));
        properties.getTieBreak().setTimeout(Duration.ofMillis(100));
        properties.getTieBreak().setJudge("llm");

        llmJudge = mock(TieBreakJudgePort.class);
        when(llmJudge.getJudgeId()).thenReturn("llm");
        scoringEngine = spy(new ScoringEngine(properties));
        PlanEnricher planEnricher = new PlanEnricher(properties);
        catalogService = new CatalogService(store, properties, clock);
        selectionService = new SelectionService(
                catalogService,
                new PolicyFilter(properties),
                scoringEngine,
                new TieBreakEscalator(properties, List.of(llmJudge, new FirstCandidateTieBreakJudge()),
                        new ObjectMapper()),
                planEnricher,
                new SelectionCache(properties, clock),
                new RequestFingerprinter(properties),
                new RetryAfterPolicy(properties),
                properties,
                clock);

        when(store.findByCapability(SERVICE_RESTART)).thenReturn(List.of(serviceRestartTool()));
    }

    @Test
    void shouldSelectProductionSafeRestartWithRouting() {
        SelectionOutcome outcome = selectionService.select(restartRequest().build());

        SelectionResult result = outcome.result();
        assertEquals(ResultSource.RESOLVED, outcome.source());
        assertEquals("service_restart", result.getToolName());
        assertEquals("systemd_restart", result.getPatternName());
        assertEquals("1.0.0", result.getToolVersion());
        assertEquals(SelectionMethod.DETERMINISTIC, result.getSelectionMethod());
        assertEquals(800.0, result.getEstimatedTimeMs());
        assertEquals(1.0, result.getEstimatedCost());
        assertEquals(ExecutionMode.IMMEDIATE, result.getExecutionMode());
        assertEquals(SlaClass.INTERACTIVE, result.getSlaClass());
        assertEquals(2, result.getCandidatesConsidered());
        assertEquals(1, result.getCandidatesEligible());
        assertTrue(result.getAlternatives().isEmpty());
        assertEquals("ssh", result.getRouting().getExecutionLocation());
        assertEquals(ProtocolType.REMOTE_SHELL, result.getRouting().getProtocol());
        assertTrue(result.getRouting().isRequiresCredentials());
        assertEquals(30_000L, result.getRouting().getTimeoutMs());
        assertEquals("service", result.getInputs().required().get(0).getName());
        assertTrue(result.getJustification().startsWith("Selected service_restart.systemd_restart"));
        assertFalse(outcome.isStale());
    }

    @Test
    void shouldReportApprovalModeAndAlternatives() {
        SelectionOutcome outcome = selectionService.select(SelectionRequest.builder()
                .capability(SERVICE_RESTART)
                .preferenceWeights(new PreferenceWeights(0, 0, 0, 0, 1))
                .build());

        SelectionResult result = outcome.result();
        assertEquals("full_redeploy", result.getPatternName());
        assertEquals(ExecutionMode.APPROVAL_REQUIRED, result.getExecutionMode());
        assertEquals(SlaClass.BACKGROUND, result.getSlaClass());
        assertEquals(List.of("service_restart.systemd_restart"), result.getAlternatives());
    }

    @Test
    void shouldServeIdenticalRequestFromCache() {
        SelectionOutcome first = selectionService.select(restartRequest().build());
        clock.advance(Duration.ofSeconds(30));
        SelectionOutcome second = selectionService.select(restartRequest().build());

        assertEquals(ResultSource.CACHE, second.source());
        assertSame(first.result(), second.result());
        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(30_000L, second.ageMs());
        verify(scoringEngine, times(1)).score(anyList(), any());
    }

    @Test
    void shouldResolveAgainWhenCacheDisabled() {
        properties.getSelection().setCacheEnabled(false);

        SelectionResult first = selectionService.select(restartRequest().build()).result();
        SelectionResult second = selectionService.select(restartRequest().build()).result();

        assertEquals(first, second);
        verify(scoringEngine, times(2)).score(anyList(), any());
    }

    @Test
    void shouldServeWarmKeyWhileCatalogDown() {
        SelectionOutcome warm = selectionService.select(restartRequest().build());
        catalogService.invalidate();
        clock.advance(Duration.ofMinutes(6));
        when(store.findByCapability(SERVICE_RESTART)).thenThrow(new CatalogUnavailableException("db down"));

        SelectionOutcome outcome = selectionService.select(restartRequest().build());

        assertEquals(ResultSource.STALE_CACHE, outcome.source());
        assertTrue(outcome.isStale());
        assertSame(warm.result(), outcome.result());
        assertEquals(Duration.ofMinutes(6).toMillis(), outcome.ageMs());
    }

    @Test
    void shouldRejectWarmKeyPastStaleGrace() {
        selectionService.select(restartRequest().build());
        catalogService.invalidate();
        clock.advance(Duration.ofMinutes(12));
        when(store.findByCapability(SERVICE_RESTART)).thenThrow(new CatalogUnavailableException("db down"));

        assertThrows(ServiceUnavailableException.class, () -> selectionService.select(restartRequest().build()));
    }

    @Test
    void shouldFailFastOnColdKeyWithGrowingRetryHint() {
        when(store.findByCapability(SERVICE_RESTART)).thenThrow(new CatalogUnavailableException("db down"));

        ServiceUnavailableException first = assertThrows(ServiceUnavailableException.class,
                () -> selectionService.select(restartRequest().build()));
        ServiceUnavailableException second = assertThrows(ServiceUnavailableException.class,
                () -> selectionService.select(restartRequest().build()));

        assertEquals(30, first.getRetryAfterSeconds());
        assertEquals(60, second.getRetryAfterSeconds());
        assertTrue(first.getCause() instanceof CatalogUnavailableException);
    }

    @Test
    void shouldMarkResultResolvedFromStaleCatalog() {
        selectionService.select(restartRequest().n(1).build());
        clock.advance(Duration.ofMinutes(6));
        when(store.findByCapability(SERVICE_RESTART)).thenThrow(new CatalogUnavailableException("db down"));

        SelectionOutcome outcome = selectionService.select(restartRequest().n(2).build());

        assertEquals(ResultSource.RESOLVED, outcome.source());
        assertTrue(outcome.result().isCatalogStale());
        assertTrue(outcome.isStale());
    }

    @Test
    void shouldKeepWarmKeyAfterServingFromStaleCatalog() {
        SelectionOutcome warm = selectionService.select(restartRequest().build());
        clock.advance(Duration.ofMinutes(6));
        when(store.findByCapability(SERVICE_RESTART)).thenThrow(new CatalogUnavailableException("db down"));

        SelectionOutcome fromStaleCatalog = selectionService.select(restartRequest().build());
        assertEquals(ResultSource.RESOLVED, fromStaleCatalog.source());
        assertTrue(fromStaleCatalog.isStale());

        catalogService.invalidate();
        clock.advance(Duration.ofMinutes(2));
        SelectionOutcome outcome = selectionService.select(restartRequest().build());

        assertEquals(ResultSource.STALE_CACHE, outcome.source());
        assertSame(warm.result(), outcome.result());
        assertEquals(Duration.ofMinutes(8).toMillis(), outcome.ageMs());
    }

    @Test
    void shouldRejectMalformedRequest() {
        InvalidRequestException error = assertThrows(InvalidRequestException.class,
                () -> selectionService.select(SelectionRequest.builder()
                        .capability(" ")
                        .n(-1)
                        .preferenceWeights(new PreferenceWeights(-1, 0, 0, 0, 0))
                        .budget(new Budget(-5.0, null))
                        .build()));

        assertEquals(4, error.getDetails().size());
    }

    @Test
    void shouldRejectAllZeroWeights() {
        assertThrows(InvalidRequestException.class, () -> selectionService.select(SelectionRequest.builder()
                .capability(SERVICE_RESTART)
                .preferenceWeights(new PreferenceWeights(0, 0, 0, 0, 0))
                .build()));
    }

    @Test
    void shouldRejectWhenBudgetExcludesEveryCandidate() {
        NoEligibleCandidateException error = assertThrows(NoEligibleCandidateException.class,
                () -> selectionService.select(SelectionRequest.builder()
                        .capability(SERVICE_RESTART)
                        .budget(new Budget(null, 0.0))
                        .build()));

        assertEquals(SERVICE_RESTART, error.getCapability());
        assertTrue(error.getRejections().stream()
                .allMatch(r -> r.violation() == PolicyViolation.COST_EXCEEDS_BUDGET));
    }

    @Test
    void shouldRejectUnknownCapability() {
        when(store.findByCapability("teleport")).thenReturn(List.of());

        NoEligibleCandidateException error = assertThrows(NoEligibleCandidateException.class,
                () -> selectionService.select(SelectionRequest.builder().capability("teleport").build()));

        assertTrue(error.getRejections().isEmpty());
    }

    @Test
    void shouldKeepDeterministicLeaderWhenJudgeTimesOut() {
        stubTiedPingTools();
        when(llmJudge.resolveTie(anyList(), anyString())).thenReturn(new CompletableFuture<>());

        SelectionResult result = selectionService.select(SelectionRequest.builder().capability(PING).build())
                .result();

        assertEquals("alpha", result.getToolName());
        assertEquals(SelectionMethod.DETERMINISTIC, result.getSelectionMethod());
        assertEquals(TieBreakResolution.FALLBACK_TIMEOUT, result.getTieBreak().getResolution());
        assertTrue(result.getJustification().contains("tie-break failed"));
    }

    @Test
    void shouldApplyJudgeChoiceOnNearTie() {
        stubTiedPingTools();
        when(llmJudge.resolveTie(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                "{\"choice\": \"beta.run\", \"reason\": \"closer to the target host\"}"));

        SelectionResult result = selectionService.select(SelectionRequest.builder().capability(PING).build())
                .result();

        assertEquals("beta", result.getToolName());
        assertEquals(SelectionMethod.TIE_BREAK, result.getSelectionMethod());
        assertTrue(result.getJustification().endsWith("closer to the target host"));
        assertEquals(List.of("alpha.run"), result.getAlternatives());
    }

    private void stubTiedPingTools() {
        Pattern same = pattern("100", "1", match(0.5, 0.5, 0.5, 0.5, 0.5));
        when(store.findByCapability(PING)).thenReturn(List.of(
                tool("beta", "1.0.0", PING, Map.of("run", same)),
                tool("alpha", "1.0.0", PING, Map.of("run", same))));
    }

    private static SelectionRequest.SelectionRequestBuilder restartRequest() {
        return SelectionRequest.builder()
                .capability(SERVICE_RESTART)
                .n(1)
                .productionSafeOnly(true);
    }
}
