package com.forgeflow.repository;

import com.forgeflow.model.entity.User;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {
}
