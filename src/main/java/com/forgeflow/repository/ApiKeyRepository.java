package com.forgeflow.repository;

import com.forgeflow.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository for API Key entities.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, Long> {

    /**
     * Candidate keys sharing a lookup digest, in verification order.
     */
    @Query("SELECT * FROM api_keys WHERE lookup_hash = :lookupHash ORDER BY id ASC")
    Flux<ApiKey> findCandidatesByLookupHash(String lookupHash);

    /**
     * All keys of a user, oldest first.
     */
    Flux<ApiKey> findByUserIdOrderByIdAsc(Long userId);

    /**
     * Update last used timestamp.
     */
    @Modifying
    @Query("UPDATE api_keys SET last_used_at = :usedAt WHERE id = :id")
    Mono<Integer> updateLastUsed(Long id, Instant usedAt);
}
