package com.forgeflow.model.dto;

import com.forgeflow.model.entity.ApiKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * API key metadata. Never carries the secret or its hashes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyResponse {
    private Long id;
    private String name;
    private String keyPrefix;
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant expiresAt;

    public static ApiKeyResponse from(ApiKey key) {
        return ApiKeyResponse.builder()
                .id(key.getId())
                .name(key.getName())
                .keyPrefix(key.getKeyPrefix())
                .createdAt(key.getCreatedAt())
                .lastUsedAt(key.getLastUsedAt())
                .expiresAt(key.getExpiresAt())
                .build();
    }
}
