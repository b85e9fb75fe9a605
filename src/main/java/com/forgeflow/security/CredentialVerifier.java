package com.forgeflow.security;

import com.forgeflow.model.entity.ApiKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Picks the API key a presented secret authenticates as.
 *
 * <p>Candidates are scanned in iteration order. A candidate wins when the secret matches its
 * hash and it is not expired at {@code now}; an expired match does not stop the scan.
 * This class does no I/O and blocks on bcrypt, so reactive callers must run it off the event loop.
 */
@Component
@RequiredArgsConstructor
public class CredentialVerifier {

    private final ApiKeyHasher apiKeyHasher;

    public Optional<ApiKey> findFirstValid(String presentedSecret, Iterable<ApiKey> candidates, Instant now) {
        for (ApiKey candidate : candidates) {
            if (!apiKeyHasher.matches(presentedSecret, candidate.getKeyHash())) {
                continue;
            }
            if (candidate.isExpiredAt(now)) {
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
