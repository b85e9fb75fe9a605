package com.forgeflow.model.dto;

import com.forgeflow.model.entity.FlowRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for a flow run. Status is rendered in lower case.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowRunResponse {
    private Long id;
    private Long flowId;
    private String status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static FlowRunResponse from(FlowRun run) {
        return FlowRunResponse.builder()
                .id(run.getId())
                .flowId(run.getFlowId())
                .status(run.getStatus().getValue())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();
    }
}
