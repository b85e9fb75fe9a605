package com.forgeflow.service;

import com.forgeflow.exception.DuplicateResourceException;
import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.model.dto.ApiKeyIssueResponse;
import com.forgeflow.model.entity.ApiKey;
import com.forgeflow.repository.ApiKeyRepository;
import com.forgeflow.security.ApiKeyHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ApiKeyService.
 */
@ExtendWith(MockitoExtension.class)
class ApiKeyServiceTest {

    private static final Instant NOW = Instant.parse("2025-12-31T00:00:00Z");

    @Mock
    private ApiKeyRepository apiKeyRepository;

    private ApiKeyHasher hasher;
    private ApiKeyService apiKeyService;

    @BeforeEach
    void setUp() {
        hasher = new ApiKeyHasher("test-lookup-secret", 4);
        apiKeyService = new ApiKeyService(apiKeyRepository, hasher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void issue_RevealsSecretOnceAndStoresOnlyDerivations() {
        when(apiKeyRepository.save(any(ApiKey.class))).thenAnswer(invocation -> {
            ApiKey key = invocation.getArgument(0);
            key.setId(5L);
            return Mono.just(key);
        });
        Instant expiry = NOW.plusSeconds(3600);

        ApiKeyIssueResponse response = apiKeyService.issue(1L, "ci", expiry).block();

        ArgumentCaptor<ApiKey> saved = ArgumentCaptor.forClass(ApiKey.class);
        verify(apiKeyRepository).save(saved.capture());
        ApiKey stored = saved.getValue();
        String secret = response.getApiKey();

        assertTrue(secret.startsWith("ff_"));
        assertNotEquals(secret, stored.getKeyHash());
        assertTrue(hasher.matches(secret, stored.getKeyHash()));
        assertEquals(hasher.lookupDigest(secret), stored.getLookupHash());
        assertEquals(secret.substring(0, 7), stored.getKeyPrefix());
        assertEquals(1L, stored.getUserId());
        assertEquals(NOW, stored.getCreatedAt());
        assertEquals(expiry, stored.getExpiresAt());
        assertEquals(5L, response.getKey().getId());
        assertEquals("ci", response.getKey().getName());
    }

    @Test
    void issue_WithSuppliedSecret_UsesIt() {
        when(apiKeyRepository.save(any(ApiKey.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(apiKeyService.issue(1L, "bootstrap", null, "ff_supplied_secret"))
                .expectNextMatches(response -> response.getApiKey().equals("ff_supplied_secret")
                        && response.getKey().getExpiresAt() == null)
                .verifyComplete();
    }

    @Test
    void issue_ForMissingUser_NotFound() {
        when(apiKeyRepository.save(any(ApiKey.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("fk_api_keys_user")));

        StepVerifier.create(apiKeyService.issue(99L, "ghost", null))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void issue_DuplicateKeyHash_ReportedAsDuplicate() {
        when(apiKeyRepository.save(any(ApiKey.class)))
                .thenReturn(Mono.error(new DuplicateKeyException("api_keys_key_hash_key")));

        StepVerifier.create(apiKeyService.issue(1L, "ci", null, "ff_supplied_secret"))
                .expectError(DuplicateResourceException.class)
                .verify();
    }

    @Test
    void listKeys_ReturnsMetadataOnly() {
        ApiKey key = ApiKey.builder()
                .id(3L)
                .userId(1L)
                .name("laptop")
                .keyPrefix("ff_abcd")
                .keyHash("$2a$04$hash")
                .lookupHash("digest")
                .createdAt(NOW)
                .build();
        when(apiKeyRepository.findByUserIdOrderByIdAsc(1L)).thenReturn(Flux.just(key));

        StepVerifier.create(apiKeyService.listKeys(1L))
                .expectNextMatches(response -> response.getId().equals(3L)
                        && response.getKeyPrefix().equals("ff_abcd")
                        && !response.toString().contains("$2a$04$hash")
                        && !response.toString().contains("digest"))
                .verifyComplete();
    }
}
