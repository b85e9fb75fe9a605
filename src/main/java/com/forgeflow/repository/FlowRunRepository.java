package com.forgeflow.repository;

import com.forgeflow.model.entity.FlowRun;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository for FlowRun entities.
 */
@Repository
public interface FlowRunRepository extends ReactiveCrudRepository<FlowRun, Long> {

    /**
     * Find a run only if the whole chain run → flow → project resolves to the given owner.
     */
    @Query("SELECT r.* FROM flow_runs r " +
            "JOIN flows f ON f.id = r.flow_id " +
            "JOIN projects p ON p.id = f.project_id " +
            "WHERE r.id = :runId AND p.owner_id = :ownerId")
    Mono<FlowRun> findOwnedRun(Long runId, Long ownerId);

    Flux<FlowRun> findByFlowIdOrderByIdAsc(Long flowId);

    /**
     * Move a run to a new status only if it is still in {@code expectedStatus}.
     * Returns the number of rows updated (0 or 1).
     */
    @Modifying
    @Query("UPDATE flow_runs SET status = :newStatus, started_at = :startedAt, completed_at = :completedAt " +
            "WHERE id = :id AND status = :expectedStatus")
    Mono<Integer> compareAndSetStatus(Long id, String expectedStatus, String newStatus,
                                      Instant startedAt, Instant completedAt);
}
