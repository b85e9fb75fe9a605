package com.forgeflow.exception;

import com.forgeflow.model.entity.FlowRunStatus;

/**
 * Exception thrown when a flow run is moved along an edge the lifecycle does not allow,
 * or when its status changed underneath the caller.
 */
public class InvalidTransitionException extends RuntimeException {

    private final FlowRunStatus from;
    private final FlowRunStatus to;

    public InvalidTransitionException(FlowRunStatus from, FlowRunStatus to) {
        super(String.format("Flow run cannot transition from '%s' to '%s'", from.getValue(), to.getValue()));
        this.from = from;
        this.to = to;
    }

    public FlowRunStatus getFrom() {
        return from;
    }

    public FlowRunStatus getTo() {
        return to;
    }
}
