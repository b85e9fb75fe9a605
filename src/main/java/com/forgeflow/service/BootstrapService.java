package com.forgeflow.service;

import com.forgeflow.exception.DuplicateResourceException;
import com.forgeflow.model.dto.ApiKeyIssueResponse;
import com.forgeflow.model.entity.User;
import com.forgeflow.repository.UserRepository;
import com.forgeflow.security.ApiKeyHasher;
import com.forgeflow.util.ApiKeyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Provisions the administrative user and its single API key on an empty database.
 */
@Slf4j
@Service
public class BootstrapService {

    static final String BOOTSTRAP_KEY_NAME = "bootstrap";

    private final UserRepository userRepository;
    private final ApiKeyService apiKeyService;
    private final ApiKeyHasher apiKeyHasher;
    private final Clock clock;
    private final String adminEmail;
    private final String configuredApiKey;

    public BootstrapService(UserRepository userRepository,
                            ApiKeyService apiKeyService,
                            ApiKeyHasher apiKeyHasher,
                            Clock clock,
                            @Value("${forgeflow.bootstrap.admin-email}") String adminEmail,
                            @Value("${forgeflow.bootstrap.admin-api-key:}") String configuredApiKey) {
        this.userRepository = userRepository;
        this.apiKeyService = apiKeyService;
        this.apiKeyHasher = apiKeyHasher;
        this.clock = clock;
        this.adminEmail = adminEmail;
        this.configuredApiKey = configuredApiKey;
    }

    /**
     * Create the admin user and its key if no user exists yet.
     *
     * @return The issuance, or empty when users already exist
     */
    @Transactional
    public Mono<ApiKeyIssueResponse> provisionIfEmpty() {
        return userRepository.count()
                .flatMap(count -> {
                    if (count > 0) {
                        log.info("Skipping bootstrap, {} user(s) already present", count);
                        return Mono.empty();
                    }
                    return createAdmin();
                });
    }

    /**
     * Whether the issued secret was generated here and still has to be shown to the operator.
     */
    public boolean generatesSecret() {
        return configuredApiKey == null || configuredApiKey.isBlank();
    }

    private Mono<ApiKeyIssueResponse> createAdmin() {
        String secret = generatesSecret() ? ApiKeyUtil.generateApiKey() : configuredApiKey;

        return Mono.fromCallable(() -> User.builder()
                        .email(adminEmail)
                        // random, never revealed: the admin cannot log in with a password
                        .passwordHash(apiKeyHasher.hash(ApiKeyUtil.randomToken()))
                        .createdAt(clock.instant())
                        .build())
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(userRepository::save)
                .onErrorMap(DuplicateKeyException.class, e -> new DuplicateResourceException("User", adminEmail))
                .flatMap(admin -> {
                    log.info("Created admin user {} ({})", admin.getId(), admin.getEmail());
                    return apiKeyService.issue(admin.getId(), BOOTSTRAP_KEY_NAME, null, secret);
                });
    }
}
