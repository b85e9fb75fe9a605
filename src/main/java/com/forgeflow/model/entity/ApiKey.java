package com.forgeflow.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * API Key entity for user authentication.
 *
 * Only one-way derivations of the secret are stored: a bcrypt hash for
 * verification and a keyed lookup digest for narrowing candidates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKey {

    @Id
    private Long id;

    @Column("user_id")
    private Long userId;

    @Column("key_hash")
    private String keyHash;

    @Column("lookup_hash")
    private String lookupHash;

    @Column("key_prefix")
    private String keyPrefix;

    @Column("name")
    private String name;

    @Column("created_at")
    private Instant createdAt;

    @Column("last_used_at")
    private Instant lastUsedAt;

    @Column("expires_at")
    private Instant expiresAt;

    /**
     * A key with no expiry never expires; otherwise it is usable only strictly before {@code expiresAt}.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
