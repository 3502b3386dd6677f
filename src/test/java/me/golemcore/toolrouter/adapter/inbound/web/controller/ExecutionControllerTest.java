package me.golemcore.toolrouter.adapter.inbound.web.controller;

import me.golemcore.toolrouter.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.model.ExecutionPlan;
import me.golemcore.toolrouter.domain.model.FailurePolicy;
import me.golemcore.toolrouter.domain.model.PlanResult;
import me.golemcore.toolrouter.domain.model.PlanStatus;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.domain.model.StepStatus;
import me.golemcore.toolrouter.domain.service.BackendRegistry;
import me.golemcore.toolrouter.domain.service.ExecutionDispatcher;
import me.golemcore.toolrouter.domain.service.PlanRegistry;
import me.golemcore.toolrouter.domain.service.TelemetryRecorder;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionControllerTest {

    private ExecutionDispatcher dispatcher;
    private PlanRegistry planRegistry;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        dispatcher = mock(ExecutionDispatcher.class);
        planRegistry = mock(PlanRegistry.class);
        webTestClient = WebTestClient.bindToController(new ExecutionController(dispatcher, planRegistry))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldDispatchPlanAndReturnResult() {
        when(dispatcher.dispatch(any(ExecutionPlan.class))).thenReturn(PlanResult.builder()
                .planId("plan-1")
                .overallStatus(PlanStatus.PARTIAL)
                .failurePolicy(FailurePolicy.CONTINUE_AND_COLLECT)
                .stepResults(List.of(
                        StepResult.builder().stepId("restart").status(StepStatus.SUCCEEDED).output("ok").build(),
                        StepResult.builder().stepId("verify").status(StepStatus.FAILED).error("exit 1")
                                .exitCode(1).build()))
                .durationMs(420)
                .build());

        webTestClient.post()
                .uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"planId\":\"plan-1\",\"failurePolicy\":\"continue-and-collect\",\"maxConcurrency\":2,"
                        + "\"steps\":[{\"id\":\"restart\",\"toolName\":\"service_restart\","
                        + "\"executionLocation\":\"ssh\",\"targetHost\":\"web-01\"},"
                        + "{\"id\":\"verify\",\"toolName\":\"log_search\",\"dependsOn\":[\"restart\"]}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.planId").isEqualTo("plan-1")
                .jsonPath("$.overallStatus").isEqualTo("PARTIAL")
                .jsonPath("$.failurePolicy").isEqualTo("continue-and-collect")
                .jsonPath("$.stepResults[1].status").isEqualTo("FAILED")
                .jsonPath("$.stepResults[1].exitCode").isEqualTo(1);

        ArgumentCaptor<ExecutionPlan> captor = ArgumentCaptor.forClass(ExecutionPlan.class);
        verify(dispatcher).dispatch(captor.capture());
        ExecutionPlan plan = captor.getValue();
        assertEquals(FailurePolicy.CONTINUE_AND_COLLECT, plan.getFailurePolicy());
        assertEquals(2, plan.getMaxConcurrency());
        assertEquals(2, plan.getSteps().size());
        assertEquals("web-01", plan.getSteps().get(0).getTargetHost());
        assertEquals(List.of("restart"), plan.getSteps().get(1).getDependsOn());
    }

    @Test
    void shouldReturnBadRequestForMalformedPlan() {
        when(dispatcher.dispatch(any(ExecutionPlan.class)))
                .thenThrow(new InvalidRequestException("Malformed execution plan", List.of("duplicate step id a")));

        webTestClient.post()
                .uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"steps\":[{\"id\":\"a\"},{\"id\":\"a\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.details[0]").isEqualTo("duplicate step id a");
    }

    @Test
    void shouldTreatNullDependenciesAsNone() {
        ExecutionDispatcher realDispatcher = realDispatcher();
        try {
            WebTestClient client = WebTestClient
                    .bindToController(new ExecutionController(realDispatcher, planRegistry))
                    .controllerAdvice(new GlobalExceptionHandler())
                    .build();

            client.post()
                    .uri("/api/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"steps\":[{\"id\":\"a\",\"executionLocation\":\"local\",\"dependsOn\":null,"
                            + "\"inputs\":null,\"protocolMetadata\":null}]}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.overallStatus").isEqualTo("SUCCEEDED")
                    .jsonPath("$.stepResults[0].stepId").isEqualTo("a");
        } finally {
            realDispatcher.destroy();
        }
    }

    @Test
    void shouldRejectNullStep() {
        ExecutionDispatcher realDispatcher = realDispatcher();
        try {
            WebTestClient client = WebTestClient
                    .bindToController(new ExecutionController(realDispatcher, planRegistry))
                    .controllerAdvice(new GlobalExceptionHandler())
                    .build();

            client.post()
                    .uri("/api/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"steps\":[null,{\"id\":\"b\",\"dependsOn\":[null]}]}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_REQUEST")
                    .jsonPath("$.details[0]").isEqualTo("step #1 is null")
                    .jsonPath("$.details[1]").isEqualTo("step b has an empty dependency");
        } finally {
            realDispatcher.destroy();
        }
    }

    @Test
    void shouldHideUnexpectedErrors() {
        when(dispatcher.dispatch(any(ExecutionPlan.class))).thenThrow(new IllegalStateException("pool closed"));

        webTestClient.post()
                .uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"steps\":[{\"id\":\"a\"}]}")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INTERNAL_ERROR")
                .jsonPath("$.message").isEqualTo("Internal server error");
    }

    @Test
    void shouldReturnPlanSnapshot() {
        when(planRegistry.getResult("plan-1")).thenReturn(Optional.of(PlanResult.builder()
                .planId("plan-1")
                .overallStatus(PlanStatus.RUNNING)
                .stepResults(List.of())
                .build()));
        when(planRegistry.getResult("missing")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/plans/plan-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overallStatus").isEqualTo("RUNNING");

        webTestClient.get()
                .uri("/api/plans/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Plan not found: missing");
    }

    @Test
    void shouldCancelRunningPlanOnly() {
        when(planRegistry.cancel("plan-1")).thenReturn(true);
        when(planRegistry.cancel("done")).thenReturn(false);

        webTestClient.post()
                .uri("/api/plans/plan-1/cancel")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.planId").isEqualTo("plan-1")
                .jsonPath("$.cancelled").isEqualTo(true);

        webTestClient.post()
                .uri("/api/plans/done/cancel")
                .exchange()
                .expectStatus().isNotFound();
    }

    private static ExecutionDispatcher realDispatcher() {
        ToolRouterProperties properties = new ToolRouterProperties();
        BackendAdapterPort local = mock(BackendAdapterPort.class);
        when(local.getLocation()).thenReturn("local");
        when(local.execute(any(), any())).thenReturn(StepResult.success("ok", 0));
        return new ExecutionDispatcher(new BackendRegistry(List.of(local), properties), new PlanRegistry(properties),
                mock(TelemetryRecorder.class), properties, Clock.systemUTC());
    }
}
