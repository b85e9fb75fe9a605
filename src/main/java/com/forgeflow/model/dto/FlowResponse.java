package com.forgeflow.model.dto;

import com.forgeflow.model.entity.Flow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for flow data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowResponse {
    private Long id;
    private Long projectId;
    private String name;
    private String description;
    private Instant createdAt;
    private Instant updatedAt;

    public static FlowResponse from(Flow flow) {
        return FlowResponse.builder()
                .id(flow.getId())
                .projectId(flow.getProjectId())
                .name(flow.getName())
                .description(flow.getDescription())
                .createdAt(flow.getCreatedAt())
                .updatedAt(flow.getUpdatedAt())
                .build();
    }
}
