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
 * Project entity, owned by a single user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("projects")
public class Project {

    @Id
    private Long id;

    @Column("owner_id")
    private Long ownerId;

    @Column("name")
    private String name;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;
}
