package com.forgeflow.repository;

import com.forgeflow.model.entity.Flow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for Flow entities.
 */
@Repository
public interface FlowRepository extends ReactiveCrudRepository<Flow, Long> {

    /**
     * Find a flow only if its project belongs to the given owner.
     */
    @Query("SELECT f.* FROM flows f JOIN projects p ON p.id = f.project_id " +
            "WHERE f.id = :flowId AND p.owner_id = :ownerId")
    Mono<Flow> findOwnedFlow(Long flowId, Long ownerId);

    Flux<Flow> findByProjectIdOrderByIdAsc(Long projectId);
}
