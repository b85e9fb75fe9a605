package com.forgeflow.service;

import com.forgeflow.exception.InvalidTransitionException;
import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.dto.FlowRunResponse;
import com.forgeflow.model.entity.FlowRun;
import com.forgeflow.model.entity.FlowRunStatus;
import com.forgeflow.repository.FlowRepository;
import com.forgeflow.repository.FlowRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Service for flow run records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowRunService {

    private final FlowRepository flowRepository;
    private final FlowRunRepository flowRunRepository;
    private final FlowRunLifecycle lifecycle;
    private final Clock clock;

    /**
     * Create a pending run for a flow owned by the user. No execution is triggered.
     *
     * @param ownerId Authenticated user ID
     * @param flowId Flow ID
     * @return Created run
     */
    @Transactional
    public Mono<FlowRunResponse> createRun(Long ownerId, Long flowId) {
        return flowRepository.findOwnedFlow(flowId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Flow", flowId)))
                .flatMap(flow -> flowRunRepository.save(lifecycle.newRun(flow.getId(), clock.instant())))
                // flow deleted between the ownership check and the insert
                .onErrorMap(DataIntegrityViolationException.class, e -> new ResourceNotFoundException("Flow", flowId))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnNext(run -> log.info("Created run {} for flow {}", run.getId(), flowId))
                .map(FlowRunResponse::from);
    }

    /**
     * List runs of a flow owned by the user.
     */
    public Flux<FlowRunResponse> listRuns(Long ownerId, Long flowId) {
        return flowRepository.findOwnedFlow(flowId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Flow", flowId)))
                .flatMapMany(flow -> flowRunRepository.findByFlowIdOrderByIdAsc(flow.getId()))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .map(FlowRunResponse::from);
    }

    /**
     * Get a run whose flow belongs to one of the user's projects.
     */
    public Mono<FlowRunResponse> getRun(Long ownerId, Long runId) {
        return flowRunRepository.findOwnedRun(runId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Flow run", runId)))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .map(FlowRunResponse::from);
    }

    /**
     * Move a run to a new status.
     *
     * <p>The write only succeeds if the stored status is still the one the transition was
     * computed from; otherwise the run moved concurrently and the transition is rejected.
     *
     * @param runId Run ID
     * @param target Target status
     * @return Updated run
     */
    @Transactional
    public Mono<FlowRunResponse> transition(Long runId, FlowRunStatus target) {
        return flowRunRepository.findById(runId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Flow run", runId)))
                .flatMap(run -> {
                    FlowRun next = lifecycle.transition(run, target, clock.instant());
                    return flowRunRepository.compareAndSetStatus(run.getId(), run.getStatus().name(),
                                    next.getStatus().name(), next.getStartedAt(), next.getCompletedAt())
                            .flatMap(updated -> {
                                if (updated == 0) {
                                    return Mono.<FlowRun>error(new InvalidTransitionException(run.getStatus(), target));
                                }
                                return Mono.just(next);
                            });
                })
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnNext(run -> log.info("Run {} is now {}", run.getId(), run.getStatus().getValue()))
                .map(FlowRunResponse::from);
    }
}
