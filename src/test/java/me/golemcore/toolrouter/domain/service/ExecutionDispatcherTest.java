package me.golemcore.toolrouter.domain.service;

import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.ExecutionPlan;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.model.PlanStatus;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.domain.model.StepStatus;
import me.golemcore.toolrouter.domain.model.TelemetryRecord;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ExecutionDispatcherTest {

    private ScriptedBackend local;
    private ScriptedBackend ssh;
    private PlanRegistry planRegistry;
    private TelemetryRecorder telemetryRecorder;
    private ExecutionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        ToolRouterProperties properties = new ToolRouterProperties();
        properties.getDispatch().setMaxConcurrency(10);
        local = new ScriptedBackend("local");
        ssh = new ScriptedBackend("ssh");
        planRegistry = new PlanRegistry(properties);
        telemetryRecorder = mock(TelemetryRecorder.class);
        dispatcher = new ExecutionDispatcher(new BackendRegistry(List.of(local, ssh), properties), planRegistry,
                telemetryRecorder, properties, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        dispatcher.destroy();
    }

    @Test
    void shouldRunAllStepsInOrderWhenEverythingSucceeds() {
        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.ABORT_ON_FIRST_FAILURE,
                step("stop", "ssh"), step("start", "ssh")));

        assertEquals(PlanStatus.SUCCEEDED, result.getOverallStatus());
        assertEquals(List.of("stop", "start"), result.getStepResults().stream().map(StepResult::getStepId).toList());
        assertEquals(List.of("stop", "start"), ssh.executed);
        assertEquals("ssh", result.getStepResults().get(0).getExecutionLocation());
        assertEquals("service_restart", result.getStepResults().get(0).getToolName());
        verify(telemetryRecorder, times(2)).record(any(TelemetryRecord.class));
    }

    @Test
    void shouldSkipRemainingStepsAfterFirstFailure() {
        ssh.behave("stop", (step, token) -> StepResult.failure("unit not found", "", 5));

        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.ABORT_ON_FIRST_FAILURE,
                step("stop", "ssh"), step("start", "ssh")));

        assertEquals(PlanStatus.FAILED, result.getOverallStatus());
        assertEquals(StepStatus.FAILED, result.getStepResults().get(0).getStatus());
        assertEquals(5, result.getStepResults().get(0).getExitCode());
        assertEquals(StepStatus.SKIPPED, result.getStepResults().get(1).getStatus());
        assertTrue(result.getStepResults().get(1).getError().contains("stop"));
        assertEquals(List.of("stop"), ssh.executed);

        ArgumentCaptor<TelemetryRecord> telemetry = ArgumentCaptor.forClass(TelemetryRecord.class);
        verify(telemetryRecorder).record(telemetry.capture());
        assertEquals("systemd_restart", telemetry.getValue().getPattern());
        assertEquals(false, telemetry.getValue().isSuccess());
        assertEquals(1.5, telemetry.getValue().getObservedCost(), 1e-9);
    }

    @Test
    void shouldCollectResultsAndSkipDependentsOfFailedSteps() {
        ssh.behave("a", (step, token) -> {
            throw new StepExecutionException("connection refused", 255, "ssh: connect", null);
        });

        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.CONTINUE_AND_COLLECT,
                step("a", "ssh"),
                step("b", "ssh").toBuilder().dependsOn(List.of("a")).build(),
                step("c", "local")));

        assertEquals(PlanStatus.PARTIAL, result.getOverallStatus());
        Map<String, StepResult> byId = byId(result);
        assertEquals(StepStatus.FAILED, byId.get("a").getStatus());
        assertEquals("connection refused", byId.get("a").getError());
        assertEquals(255, byId.get("a").getExitCode());
        assertEquals(StepStatus.SKIPPED, byId.get("b").getStatus());
        assertEquals(StepStatus.SUCCEEDED, byId.get("c").getStatus());
        assertEquals(List.of("a", "b", "c"), result.getStepResults().stream().map(StepResult::getStepId).toList());
    }

    @Test
    void shouldRunDependentAfterItsDependencySucceeds() {
        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.CONTINUE_AND_COLLECT,
                step("drain", "local"),
                step("restart", "ssh").toBuilder().dependsOn(List.of("drain")).build()));

        assertEquals(PlanStatus.SUCCEEDED, result.getOverallStatus());
        assertEquals(List.of("drain"), local.executed);
        assertEquals(List.of("restart"), ssh.executed);
    }

    @Test
    void shouldTimeOutSlowStepAndCancelItsToken() {
        CountDownLatch cancelled = new CountDownLatch(1);
        ssh.behave("slow", (step, token) -> {
            token.onCancel(cancelled::countDown);
            await(cancelled);
            return StepResult.failure("interrupted");
        });

        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.ABORT_ON_FIRST_FAILURE,
                step("slow", "ssh").toBuilder().timeoutMs(100L).build(),
                step("after", "ssh")));

        StepResult slow = result.getStepResults().get(0);
        assertEquals(StepStatus.TIMED_OUT, slow.getStatus());
        assertEquals("Step exceeded timeout of 100ms", slow.getError());
        assertEquals(0, cancelled.getCount());
        assertEquals(StepStatus.SKIPPED, result.getStepResults().get(1).getStatus());
        assertEquals(PlanStatus.FAILED, result.getOverallStatus());
    }

    @Test
    void shouldStopPlanAtPlanTimeout() {
        ssh.behave("slow", (step, token) -> {
            CountDownLatch latch = new CountDownLatch(1);
            token.onCancel(latch::countDown);
            await(latch);
            return StepResult.failure("interrupted");
        });
        ExecutionPlan plan = plan(FailurePolicy.ABORT_ON_FIRST_FAILURE,
                step("slow", "ssh").toBuilder().timeoutMs(10_000L).build())
                .toBuilder().planTimeoutMs(150L).build();

        PlanResult result = dispatcher.dispatch(plan);

        assertEquals(PlanStatus.TIMED_OUT, result.getOverallStatus());
        assertEquals(StepStatus.TIMED_OUT, result.getStepResults().get(0).getStatus());
        assertEquals("Plan timeout reached", result.getStepResults().get(0).getError());
    }

    @Test
    void shouldCancelRunningPlan() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        ssh.behave("long", (step, token) -> {
            CountDownLatch latch = new CountDownLatch(1);
            token.onCancel(latch::countDown);
            started.countDown();
            await(latch);
            throw new StepExecutionException("session closed");
        });
        ExecutionPlan plan = plan(FailurePolicy.ABORT_ON_FIRST_FAILURE, step("long", "ssh"), step("next", "ssh"))
                .toBuilder().planId("plan-cancel").build();

        CompletableFuture<PlanResult> running = CompletableFuture.supplyAsync(() -> dispatcher.dispatch(plan));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(PlanStatus.RUNNING, planRegistry.getResult("plan-cancel").orElseThrow().getOverallStatus());
        assertTrue(planRegistry.cancel("plan-cancel"));
        PlanResult result = running.get(5, TimeUnit.SECONDS);

        assertEquals(PlanStatus.CANCELLED, result.getOverallStatus());
        assertEquals(StepStatus.CANCELLED, result.getStepResults().get(0).getStatus());
        assertEquals(StepStatus.SKIPPED, result.getStepResults().get(1).getStatus());
        assertEquals(result, planRegistry.getResult("plan-cancel").orElseThrow());
    }

    @Test
    void shouldRespectConcurrencyLimit() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        BiFunction<EnrichedExecutionStep, CancellationToken, StepResult> busy = (step, token) -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            sleep(100);
            inFlight.decrementAndGet();
            return StepResult.success("done");
        };
        for (String id : List.of("s1", "s2", "s3", "s4", "s5")) {
            local.behave(id, busy);
        }
        ExecutionPlan plan = plan(FailurePolicy.CONTINUE_AND_COLLECT,
                step("s1", "local"), step("s2", "local"), step("s3", "local"), step("s4", "local"),
                step("s5", "local"))
                .toBuilder().maxConcurrency(2).build();

        PlanResult result = dispatcher.dispatch(plan);

        assertEquals(PlanStatus.SUCCEEDED, result.getOverallStatus());
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void shouldDeriveConcurrencyFromDistinctHosts() {
        ExecutionPlan plan = plan(FailurePolicy.CONTINUE_AND_COLLECT,
                step("a", "ssh").toBuilder().targetHost("web-01").build(),
                step("b", "ssh").toBuilder().targetHost("web-02").build(),
                step("c", "ssh").toBuilder().targetHost("web-01").build());

        assertEquals(2, dispatcher.concurrencyLimit(plan));
        assertEquals(10, dispatcher.concurrencyLimit(plan.toBuilder().maxConcurrency(64).build()));
    }

    @Test
    void shouldFallBackToDefaultBackendForUnknownLocation() {
        PlanResult result = dispatcher.dispatch(plan(FailurePolicy.ABORT_ON_FIRST_FAILURE, step("x", "mainframe")));

        assertEquals(PlanStatus.SUCCEEDED, result.getOverallStatus());
        assertEquals("local", result.getStepResults().get(0).getExecutionLocation());
        assertEquals(List.of("x"), local.executed);
    }

    @Test
    void shouldUseObservedCostFromAdapterForTelemetry() {
        ssh.behave("stop", (step, token) -> StepResult.success("ok").toBuilder().observedCost(0.25).build());

        dispatcher.dispatch(plan(FailurePolicy.ABORT_ON_FIRST_FAILURE, step("stop", "ssh")));

        ArgumentCaptor<TelemetryRecord> telemetry = ArgumentCaptor.forClass(TelemetryRecord.class);
        verify(telemetryRecorder).record(telemetry.capture());
        assertEquals(0.25, telemetry.getValue().getObservedCost(), 1e-9);
        assertTrue(telemetry.getValue().isSuccess());
    }

    @Test
    void shouldRejectMalformedPlans() {
        assertThrows(InvalidRequestException.class,
                () -> dispatcher.dispatch(ExecutionPlan.builder().steps(List.of()).build()));

        InvalidRequestException forward = assertThrows(InvalidRequestException.class,
                () -> dispatcher.dispatch(plan(FailurePolicy.CONTINUE_AND_COLLECT,
                        step("a", "ssh").toBuilder().dependsOn(List.of("b")).build(),
                        step("b", "ssh"))));
        assertEquals(List.of("step a depends on b, which is not declared before it"), forward.getDetails());

        InvalidRequestException duplicate = assertThrows(InvalidRequestException.class,
                () -> dispatcher.dispatch(plan(FailurePolicy.CONTINUE_AND_COLLECT,
                        step("a", "ssh"), step("a", "local"))));
        assertEquals(List.of("duplicate step id a"), duplicate.getDetails());
        assertTrue(ssh.executed.isEmpty());
    }

    private static ExecutionPlan plan(FailurePolicy policy, EnrichedExecutionStep... steps) {
        return ExecutionPlan.builder()
                .steps(List.of(steps))
                .failurePolicy(policy)
                .build();
    }

    private static EnrichedExecutionStep step(String id, String location) {
        return EnrichedExecutionStep.builder()
                .id(id)
                .toolName("service_restart")
                .toolVersion("1.0.0")
                .patternName("systemd_restart")
                .capability("service_restart")
                .executionLocation(location)
                .inputs(Map.of("service", "nginx"))
                .timeoutMs(5_000L)
                .estimatedCost(1.5)
                .build();
    }

    private static Map<String, StepResult> byId(PlanResult result) {
        Map<String, StepResult> byId = new ConcurrentHashMap<>();
        result.getStepResults().forEach(r -> byId.put(r.getStepId(), r));
        return byId;
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Backend that records executed step ids and runs a per-step behaviour,
     * succeeding by default.
     */
    private static final class ScriptedBackend implements BackendAdapterPort {

        private final String location;
        private final Map<String, BiFunction<EnrichedExecutionStep, CancellationToken, StepResult>> behaviours =
                new ConcurrentHashMap<>();
        private final List<String> executed = new java.util.concurrent.CopyOnWriteArrayList<>();

        ScriptedBackend(String location) {
            this.location = location;
        }

        void behave(String stepId, BiFunction<EnrichedExecutionStep, CancellationToken, StepResult> behaviour) {
            behaviours.put(stepId, behaviour);
        }

        @Override
        public String getLocation() {
            return location;
        }

        @Override
        public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
            executed.add(step.getId());
            return behaviours.getOrDefault(step.getId(), (s, t) -> StepResult.success("ok")).apply(step, cancellation);
        }
    }
}
