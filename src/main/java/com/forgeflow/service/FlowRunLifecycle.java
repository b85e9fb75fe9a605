package com.forgeflow.service;

import com.forgeflow.exception.InvalidTransitionException;
import com.forgeflow.model.entity.FlowRun;
import com.forgeflow.model.entity.FlowRunStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * State machine of a flow run: PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED}.
 *
 * <p>{@code startedAt} is set on entering RUNNING and {@code completedAt} on entering a
 * terminal state; no other transition touches them. Runs are never mutated in place.
 */
@Component
public class FlowRunLifecycle {

    /**
     * A new run record in PENDING.
     */
    public FlowRun newRun(Long flowId, Instant now) {
        return FlowRun.builder()
                .flowId(flowId)
                .status(FlowRunStatus.PENDING)
                .createdAt(now)
                .build();
    }

    /**
     * Apply a transition.
     *
     * @return a copy of {@code run} in {@code target}
     * @throws InvalidTransitionException if the edge is not part of the lifecycle
     */
    public FlowRun transition(FlowRun run, FlowRunStatus target, Instant now) {
        FlowRunStatus current = run.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current, target);
        }
        FlowRun.FlowRunBuilder next = run.toBuilder().status(target);
        if (target == FlowRunStatus.RUNNING) {
            next.startedAt(now);
        }
        if (target.isTerminal()) {
            next.completedAt(now);
        }
        return next.build();
    }
}
