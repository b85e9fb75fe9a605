package com.forgeflow.service;

import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.dto.FlowCreateRequest;
import com.forgeflow.model.dto.FlowResponse;
import com.forgeflow.model.entity.Flow;
import com.forgeflow.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Service for flow management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowService {

    private final FlowRepository flowRepository;
    private final ProjectService projectService;
    private final Clock clock;

    /**
     * Create a flow in a project owned by the user.
     *
     * @param ownerId Authenticated user ID
     * @param request Flow create request
     * @return Flow response
     */
    @Transactional
    public Mono<FlowResponse> createFlow(Long ownerId, FlowCreateRequest request) {
        return projectService.findOwned(ownerId, request.getProjectId())
                .flatMap(project -> {
                    Instant now = clock.instant();
                    Flow flow = Flow.builder()
                            .projectId(project.getId())
                            .name(request.getName())
                            .description(request.getDescription())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return flowRepository.save(flow);
                })
                // project deleted between the ownership check and the insert
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new ResourceNotFoundException("Project", request.getProjectId()))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnNext(saved -> log.info("Created flow {} in project {}", saved.getId(), saved.getProjectId()))
                .map(FlowResponse::from);
    }

    /**
     * List flows of a project owned by the user.
     */
    public Flux<FlowResponse> listFlows(Long ownerId, Long projectId) {
        return projectService.findOwned(ownerId, projectId)
                .flatMapMany(project -> flowRepository.findByProjectIdOrderByIdAsc(project.getId()))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .map(FlowResponse::from);
    }

    /**
     * Get a flow whose project belongs to the user.
     */
    public Mono<FlowResponse> getFlow(Long ownerId, Long flowId) {
        return findOwned(ownerId, flowId).map(FlowResponse::from);
    }

    /**
     * Delete a flow and, through the database cascade, its runs.
     */
    @Transactional
    public Mono<Void> deleteFlow(Long ownerId, Long flowId) {
        return findOwned(ownerId, flowId)
                .flatMap(flowRepository::delete)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnSuccess(ignored -> log.info("Deleted flow {} of user {}", flowId, ownerId));
    }

    private Mono<Flow> findOwned(Long ownerId, Long flowId) {
        return flowRepository.findOwnedFlow(flowId, ownerId)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Flow", flowId)));
    }
}
