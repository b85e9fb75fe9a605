package com.forgeflow.service;

import com.forgeflow.exception.InvalidTransitionException;
import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.model.entity.Flow;
import com.forgeflow.model.entity.FlowRun;
import com.forgeflow.model.entity.FlowRunStatus;
import com.forgeflow.repository.FlowRepository;
import com.forgeflow.repository.FlowRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FlowRunService.
 */
@ExtendWith(MockitoExtension.class)
class FlowRunServiceTest {

    private static final Instant NOW = Instant.parse("2025-12-31T00:00:00Z");
    private static final Long OWNER_ID = 1L;
    private static final Long FLOW_ID = 5L;

    @Mock
    private FlowRepository flowRepository;

    @Mock
    private FlowRunRepository flowRunRepository;

    private FlowRunService flowRunService;
    private Flow flow;

    @BeforeEach
    void setUp() {
        flowRunService = new FlowRunService(flowRepository, flowRunRepository, new FlowRunLifecycle(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        flow = Flow.builder().id(FLOW_ID).projectId(2L).name("F1").build();
    }

    private void assignIdsOnSave() {
        AtomicLong ids = new AtomicLong(100);
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(invocation -> {
            FlowRun run = invocation.getArgument(0);
            return Mono.just(run.toBuilder().id(ids.incrementAndGet()).build());
        });
    }

    @Test
    void createRun_Success() {
        when(flowRepository.findOwnedFlow(FLOW_ID, OWNER_ID)).thenReturn(Mono.just(flow));
        assignIdsOnSave();

        StepVerifier.create(flowRunService.createRun(OWNER_ID, FLOW_ID))
                .expectNextMatches(run -> run.getId().equals(101L)
                        && run.getFlowId().equals(FLOW_ID)
                        && run.getStatus().equals("pending")
                        && run.getCreatedAt().equals(NOW)
                        && run.getStartedAt() == null
                        && run.getCompletedAt() == null)
                .verifyComplete();
    }

    @Test
    void createRun_Repeated_ProducesDistinctRuns() {
        when(flowRepository.findOwnedFlow(FLOW_ID, OWNER_ID)).thenReturn(Mono.just(flow));
        assignIdsOnSave();

        StepVerifier.create(flowRunService.createRun(OWNER_ID, FLOW_ID)
                        .concatWith(flowRunService.createRun(OWNER_ID, FLOW_ID)))
                .expectNextMatches(run -> run.getId().equals(101L))
                .expectNextMatches(run -> run.getId().equals(102L) && run.getStatus().equals("pending"))
                .verifyComplete();
    }

    @Test
    void createRun_FlowNotOwned_NotFound() {
        when(flowRepository.findOwnedFlow(FLOW_ID, 2L)).thenReturn(Mono.empty());

        StepVerifier.create(flowRunService.createRun(2L, FLOW_ID))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verify(flowRunRepository, never()).save(any(FlowRun.class));
    }

    @Test
    void createRun_FlowDeletedConcurrently_NotFound() {
        when(flowRepository.findOwnedFlow(FLOW_ID, OWNER_ID)).thenReturn(Mono.just(flow));
        when(flowRunRepository.save(any(FlowRun.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("fk_flow_runs_flow")));

        StepVerifier.create(flowRunService.createRun(OWNER_ID, FLOW_ID))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void listRuns_FlowNotOwned_NotFound() {
        when(flowRepository.findOwnedFlow(FLOW_ID, 2L)).thenReturn(Mono.empty());

        StepVerifier.create(flowRunService.listRuns(2L, FLOW_ID))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void listRuns_Success() {
        when(flowRepository.findOwnedFlow(FLOW_ID, OWNER_ID)).thenReturn(Mono.just(flow));
        when(flowRunRepository.findByFlowIdOrderByIdAsc(FLOW_ID)).thenReturn(Flux.just(
                FlowRun.builder().id(1L).flowId(FLOW_ID).status(FlowRunStatus.PENDING).createdAt(NOW).build(),
                FlowRun.builder().id(2L).flowId(FLOW_ID).status(FlowRunStatus.RUNNING).createdAt(NOW).startedAt(NOW).build()));

        StepVerifier.create(flowRunService.listRuns(OWNER_ID, FLOW_ID))
                .expectNextMatches(run -> run.getStatus().equals("pending"))
                .expectNextMatches(run -> run.getStatus().equals("running"))
                .verifyComplete();
    }

    @Test
    void getRun_NotOwned_NotFound() {
        when(flowRunRepository.findOwnedRun(9L, 2L)).thenReturn(Mono.empty());

        StepVerifier.create(flowRunService.getRun(2L, 9L))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void transition_PendingToRunning_SetsStartedAt() {
        FlowRun pending = FlowRun.builder().id(7L).flowId(FLOW_ID).status(FlowRunStatus.PENDING)
                .createdAt(NOW.minusSeconds(30)).build();
        when(flowRunRepository.findById(7L)).thenReturn(Mono.just(pending));
        when(flowRunRepository.compareAndSetStatus(eq(7L), eq("PENDING"), eq("RUNNING"), eq(NOW), isNull()))
                .thenReturn(Mono.just(1));

        StepVerifier.create(flowRunService.transition(7L, FlowRunStatus.RUNNING))
                .expectNextMatches(run -> run.getStatus().equals("running")
                        && NOW.equals(run.getStartedAt())
                        && run.getCompletedAt() == null)
                .verifyComplete();
    }

    @Test
    void transition_RunningToFailed_KeepsStartedAt() {
        Instant started = NOW.minusSeconds(30);
        FlowRun running = FlowRun.builder().id(7L).flowId(FLOW_ID).status(FlowRunStatus.RUNNING)
                .createdAt(NOW.minusSeconds(60)).startedAt(started).build();
        when(flowRunRepository.findById(7L)).thenReturn(Mono.just(running));
        when(flowRunRepository.compareAndSetStatus(7L, "RUNNING", "FAILED", started, NOW))
                .thenReturn(Mono.just(1));

        StepVerifier.create(flowRunService.transition(7L, FlowRunStatus.FAILED))
                .expectNextMatches(run -> run.getStatus().equals("failed")
                        && started.equals(run.getStartedAt())
                        && NOW.equals(run.getCompletedAt()))
                .verifyComplete();
    }

    @Test
    void transition_CompletedToRunning_Invalid() {
        FlowRun completed = FlowRun.builder().id(7L).flowId(FLOW_ID).status(FlowRunStatus.COMPLETED)
                .createdAt(NOW).startedAt(NOW).completedAt(NOW).build();
        when(flowRunRepository.findById(7L)).thenReturn(Mono.just(completed));

        StepVerifier.create(flowRunService.transition(7L, FlowRunStatus.RUNNING))
                .expectError(InvalidTransitionException.class)
                .verify();

        verify(flowRunRepository, never()).compareAndSetStatus(anyLong(), anyString(), anyString(), any(), any());
    }

    @Test
    void transition_StatusChangedConcurrently_Invalid() {
        FlowRun pending = FlowRun.builder().id(7L).flowId(FLOW_ID).status(FlowRunStatus.PENDING)
                .createdAt(NOW).build();
        when(flowRunRepository.findById(7L)).thenReturn(Mono.just(pending));
        when(flowRunRepository.compareAndSetStatus(eq(7L), eq("PENDING"), eq("RUNNING"), eq(NOW), isNull()))
                .thenReturn(Mono.just(0));

        StepVerifier.create(flowRunService.transition(7L, FlowRunStatus.RUNNING))
                .expectError(InvalidTransitionException.class)
                .verify();
    }

    @Test
    void transition_UnknownRun_NotFound() {
        when(flowRunRepository.findById(404L)).thenReturn(Mono.empty());

        StepVerifier.create(flowRunService.transition(404L, FlowRunStatus.RUNNING))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
