package com.forgeflow.service;

import com.forgeflow.exception.AuthFailure;
import com.forgeflow.exception.AuthenticationFailedException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.entity.ApiKey;
import com.forgeflow.model.entity.User;
import com.forgeflow.repository.ApiKeyRepository;
import com.forgeflow.repository.UserRepository;
import com.forgeflow.security.ApiKeyHasher;
import com.forgeflow.security.CredentialVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;

/**
 * Resolves bearer API keys to users.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

    private final ApiKeyRepository apiKeyRepository;
    private final UserRepository userRepository;
    private final ApiKeyHasher apiKeyHasher;
    private final CredentialVerifier credentialVerifier;
    private final Clock clock;

    /**
     * Verify an API key and return its owner.
     *
     * <p>On success the key's {@code last_used_at} is stamped before the user is emitted.
     * A failed stamp is logged and ignored.
     *
     * @param presentedSecret The raw bearer secret, may be null
     * @return The owning user, or an {@link AuthenticationFailedException} /
     *         {@link StoreUnavailableException} error
     */
    public Mono<User> authenticate(String presentedSecret) {
        if (presentedSecret == null || presentedSecret.isBlank()) {
            return Mono.error(new AuthenticationFailedException(AuthFailure.MISSING_CREDENTIAL));
        }
        Instant now = clock.instant();

        return Mono.fromCallable(() -> apiKeyHasher.lookupDigest(presentedSecret))
                .flatMapMany(apiKeyRepository::findCandidatesByLookupHash)
                .collectList()
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .publishOn(Schedulers.boundedElastic())
                .flatMap(candidates -> Mono.justOrEmpty(
                        credentialVerifier.findFirstValid(presentedSecret, candidates, now)))
                .switchIfEmpty(Mono.error(() -> new AuthenticationFailedException(AuthFailure.INVALID_OR_EXPIRED)))
                .flatMap(key -> recordUsage(key, now).then(resolveOwner(key)));
    }

    private Mono<Void> recordUsage(ApiKey key, Instant now) {
        return apiKeyRepository.updateLastUsed(key.getId(), now)
                .doOnNext(updated -> key.setLastUsedAt(now))
                .onErrorResume(error -> {
                    log.warn("Failed to record last use of API key {}: {}", key.getId(), error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<User> resolveOwner(ApiKey key) {
        return userRepository.findById(key.getUserId())
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("API key {} belongs to missing user {}", key.getId(), key.getUserId());
                    return new AuthenticationFailedException(AuthFailure.IDENTITY_MISSING);
                }))
                .doOnNext(user -> log.debug("Authenticated user {} with API key {}", user.getId(), key.getId()));
    }
}
