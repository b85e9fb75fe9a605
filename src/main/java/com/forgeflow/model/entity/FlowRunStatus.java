package com.forgeflow.model.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a flow run.
 *
 * PENDING is the only initial state. COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum FlowRunStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    FlowRunStatus(String value) {
        this.value = value;
    }

    /**
     * Wire representation (lower case).
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(FlowRunStatus target) {
        return successors().contains(target);
    }

    private Set<FlowRunStatus> successors() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING);
            case RUNNING:
                return EnumSet.of(COMPLETED, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(FlowRunStatus.class);
        }
    }
}
