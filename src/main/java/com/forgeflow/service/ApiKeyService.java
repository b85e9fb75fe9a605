package com.forgeflow.service;

import com.forgeflow.exception.DuplicateResourceException;
import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.dto.ApiKeyIssueResponse;
import com.forgeflow.model.dto.ApiKeyResponse;
import com.forgeflow.model.entity.ApiKey;
import com.forgeflow.repository.ApiKeyRepository;
import com.forgeflow.security.ApiKeyHasher;
import com.forgeflow.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;

/**
 * Service for API key issuance and listing.
 *
 * The plaintext secret exists only in the issuance response; nothing can retrieve it later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyHasher apiKeyHasher;
    private final Clock clock;

    /**
     * Issue a freshly generated API key for a user.
     *
     * @param userId Owner
     * @param name Human readable label
     * @param expiresAt Optional expiry
     * @return Issuance response carrying the plaintext key
     */
    public Mono<ApiKeyIssueResponse> issue(Long userId, String name, Instant expiresAt) {
        return issue(userId, name, expiresAt, ApiKeyUtil.generateApiKey());
    }

    /**
     * Issue an API key with a caller supplied secret. Used by provisioning.
     */
    public Mono<ApiKeyIssueResponse> issue(Long userId, String name, Instant expiresAt, String secret) {
        return Mono.fromCallable(() -> ApiKey.builder()
                        .userId(userId)
                        .name(name)
                        .keyHash(apiKeyHasher.hash(secret))
                        .lookupHash(apiKeyHasher.lookupDigest(secret))
                        .keyPrefix(ApiKeyUtil.getKeyPrefix(secret))
                        .createdAt(clock.instant())
                        .expiresAt(expiresAt)
                        .build())
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(apiKeyRepository::save)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new DuplicateResourceException("API key", ApiKeyUtil.getKeyPrefix(secret)))
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new ResourceNotFoundException("User", userId))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnNext(saved -> log.info("Issued API key {} for user {}", saved.getId(), userId))
                .map(saved -> ApiKeyIssueResponse.builder()
                        .key(ApiKeyResponse.from(saved))
                        .apiKey(secret)
                        .message("API key issued. Save it securely, it cannot be shown again!")
                        .build());
    }

    /**
     * List key metadata for a user.
     */
    public Flux<ApiKeyResponse> listKeys(Long userId) {
        return apiKeyRepository.findByUserIdOrderByIdAsc(userId)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .map(ApiKeyResponse::from);
    }
}
