package com.forgeflow.service;

import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.model.dto.FlowCreateRequest;
import com.forgeflow.model.entity.Flow;
import com.forgeflow.model.entity.Project;
import com.forgeflow.repository.FlowRepository;
import com.forgeflow.repository.ProjectRepository;
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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FlowService.
 */
@ExtendWith(MockitoExtension.class)
class FlowServiceTest {

    private static final Instant NOW = Instant.parse("2025-12-31T00:00:00Z");
    private static final Long OWNER_A = 1L;
    private static final Long OWNER_B = 2L;

    @Mock
    private FlowRepository flowRepository;

    @Mock
    private ProjectRepository projectRepository;

    private FlowService flowService;
    private Project project;
    private Flow flow;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        flowService = new FlowService(flowRepository, new ProjectService(projectRepository, clock), clock);
        project = Project.builder().id(3L).ownerId(OWNER_A).name("P1").build();
        flow = Flow.builder().id(5L).projectId(3L).name("F1").description("first").createdAt(NOW).updatedAt(NOW).build();
    }

    @Test
    void createFlow_InOwnedProject_Success() {
        when(projectRepository.findByIdAndOwnerId(3L, OWNER_A)).thenReturn(Mono.just(project));
        when(flowRepository.save(any(Flow.class))).thenAnswer(invocation -> {
            Flow saved = invocation.getArgument(0);
            saved.setId(5L);
            return Mono.just(saved);
        });

        FlowCreateRequest request = FlowCreateRequest.builder().projectId(3L).name("F1").description("first").build();

        StepVerifier.create(flowService.createFlow(OWNER_A, request))
                .expectNextMatches(response -> response.getId().equals(5L)
                        && response.getProjectId().equals(3L)
                        && response.getName().equals("F1")
                        && response.getDescription().equals("first")
                        && response.getCreatedAt().equals(NOW))
                .verifyComplete();
    }

    @Test
    void createFlow_InOtherUsersProject_NotFound() {
        when(projectRepository.findByIdAndOwnerId(3L, OWNER_B)).thenReturn(Mono.empty());

        FlowCreateRequest request = FlowCreateRequest.builder().projectId(3L).name("F1").build();

        StepVerifier.create(flowService.createFlow(OWNER_B, request))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verify(flowRepository, never()).save(any(Flow.class));
    }

    @Test
    void createFlow_ProjectDeletedConcurrently_NotFound() {
        when(projectRepository.findByIdAndOwnerId(3L, OWNER_A)).thenReturn(Mono.just(project));
        when(flowRepository.save(any(Flow.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("fk_flows_project")));

        FlowCreateRequest request = FlowCreateRequest.builder().projectId(3L).name("F1").build();

        StepVerifier.create(flowService.createFlow(OWNER_A, request))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void listFlows_OwnedProject() {
        when(projectRepository.findByIdAndOwnerId(3L, OWNER_A)).thenReturn(Mono.just(project));
        when(flowRepository.findByProjectIdOrderByIdAsc(3L)).thenReturn(Flux.just(flow));

        StepVerifier.create(flowService.listFlows(OWNER_A, 3L))
                .expectNextMatches(response -> response.getId().equals(5L))
                .verifyComplete();
    }

    @Test
    void listFlows_OtherUsersProject_NotFound() {
        when(projectRepository.findByIdAndOwnerId(3L, OWNER_B)).thenReturn(Mono.empty());

        StepVerifier.create(flowService.listFlows(OWNER_B, 3L))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void getFlow_OtherUser_NotFound() {
        when(flowRepository.findOwnedFlow(5L, OWNER_B)).thenReturn(Mono.empty());

        StepVerifier.create(flowService.getFlow(OWNER_B, 5L))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void deleteFlow_Owner_Deletes() {
        when(flowRepository.findOwnedFlow(5L, OWNER_A)).thenReturn(Mono.just(flow));
        when(flowRepository.delete(flow)).thenReturn(Mono.empty());

        StepVerifier.create(flowService.deleteFlow(OWNER_A, 5L))
                .verifyComplete();

        verify(flowRepository).delete(flow);
    }
}
