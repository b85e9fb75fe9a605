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
 * Flow entity, contained in a project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("flows")
public class Flow {

    @Id
    private Long id;

    @Column("project_id")
    private Long projectId;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;
}
