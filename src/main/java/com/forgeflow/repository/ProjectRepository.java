package com.forgeflow.repository;

import com.forgeflow.model.entity.Project;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for Project entities.
 */
@Repository
public interface ProjectRepository extends ReactiveCrudRepository<Project, Long> {

    /**
     * Find a project only if it belongs to the given owner.
     */
    Mono<Project> findByIdAndOwnerId(Long id, Long ownerId);

    Flux<Project> findByOwnerIdOrderByIdAsc(Long ownerId);
}
