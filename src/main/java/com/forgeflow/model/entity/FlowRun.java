package com.forgeflow.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Execution record of a flow. The owning flow never changes after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("flow_runs")
public class FlowRun {

    @Id
    private Long id;

    @Column("flow_id")
    private Long flowId;

    @Column("status")
    private FlowRunStatus status;

    @Column("created_at")
    private Instant createdAt;

    @Column("started_at")
    private Instant startedAt;

    @Column("completed_at")
    private Instant completedAt;
}
