package me.golemcore.toolrouter.domain.service;

import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.model.PlanStatus;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanRegistryTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");
    private static final List<String> STEPS = List.of("stop", "start");

    private PlanRegistry registry;

    @BeforeEach
    void setUp() {
        ToolRouterProperties properties = new ToolRouterProperties();
        properties.getDispatch().setMaxRetainedPlans(2);
        registry = new PlanRegistry(properties);
    }

    @Test
    void shouldExposeRunningSnapshotInDeclarationOrder() {
        PlanRegistry.PlanHandle handle = registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE,
                STARTED);
        handle.recordStep(StepResult.success("stopped").toBuilder().stepId("stop").build());

        PlanResult snapshot = registry.getResult("p1").orElseThrow();

        assertEquals(PlanStatus.RUNNING, snapshot.getOverallStatus());
        assertEquals(1, snapshot.getStepResults().size());
        assertEquals("stop", snapshot.getStepResults().get(0).getStepId());
        assertEquals(STARTED, snapshot.getStartedAt());
    }

    @Test
    void shouldReturnFinalResultOnceFinished() {
        PlanRegistry.PlanHandle handle = registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE,
                STARTED);
        PlanResult done = finished("p1");

        handle.finish(done);

        assertSame(done, registry.getResult("p1").orElseThrow());
        assertTrue(handle.isFinished());
    }

    @Test
    void shouldRejectSecondRegistrationOfRunningPlan() {
        registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED);

        assertThrows(InvalidRequestException.class,
                () -> registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED));
    }

    @Test
    void shouldAllowReuseOfFinishedPlanId() {
        registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED).finish(finished("p1"));

        PlanRegistry.PlanHandle again = registry.register("p1", STEPS, FailurePolicy.CONTINUE_AND_COLLECT, STARTED);

        assertFalse(again.isFinished());
        assertEquals(PlanStatus.RUNNING, registry.getResult("p1").orElseThrow().getOverallStatus());
    }

    @Test
    void shouldCancelOnlyRunningPlans() {
        PlanRegistry.PlanHandle running = registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE,
                STARTED);
        registry.register("p2", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED).finish(finished("p2"));

        assertTrue(registry.cancel("p1"));
        assertTrue(running.getToken().isCancelled());
        assertFalse(registry.cancel("p2"));
        assertFalse(registry.cancel("unknown"));
    }

    @Test
    void shouldDropOldestFinishedPlansBeyondRetention() {
        registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED).finish(finished("p1"));
        registry.register("p2", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED).finish(finished("p2"));

        registry.register("p3", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED);

        assertTrue(registry.getResult("p1").isEmpty());
        assertTrue(registry.getResult("p2").isPresent());
        assertTrue(registry.getResult("p3").isPresent());
    }

    @Test
    void shouldKeepRunningPlansEvenBeyondRetention() {
        registry.register("p1", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED);
        registry.register("p2", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED);
        registry.register("p3", STEPS, FailurePolicy.ABORT_ON_FIRST_FAILURE, STARTED);

        assertTrue(registry.getResult("p1").isPresent());
        assertTrue(registry.cancel("p1"));
    }

    private static PlanResult finished(String planId) {
        return PlanResult.builder()
                .planId(planId)
                .overallStatus(PlanStatus.SUCCEEDED)
                .failurePolicy(FailurePolicy.ABORT_ON_FIRST_FAILURE)
                .stepResults(List.of())
                .startedAt(STARTED)
                .finishedAt(STARTED.plusSeconds(1))
                .durationMs(1000)
                .build();
    }
}
