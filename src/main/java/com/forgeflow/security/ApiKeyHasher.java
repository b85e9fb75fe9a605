package com.forgeflow.security;

import com.forgeflow.util.ApiKeyUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * One-way derivations of API key secrets.
 *
 * <p>Every derivation first truncates the secret to {@link #MAX_SECRET_BYTES} bytes of UTF-8,
 * so issuance and verification always agree on the input. Changing that boundary breaks
 * every key issued before the change.
 */
@Component
public class ApiKeyHasher {

    /**
     * bcrypt ignores input beyond 72 bytes.
     */
    public static final int MAX_SECRET_BYTES = 72;

    private static final String LOOKUP_ALGORITHM = "HmacSHA256";

    private final PasswordEncoder passwordEncoder;
    private final SecretKeySpec lookupKey;

    @Autowired
    public ApiKeyHasher(@Value("${forgeflow.api-key.lookup-secret}") String lookupSecret,
                        @Value("${forgeflow.api-key.bcrypt-strength:12}") int bcryptStrength) {
        this(new BCryptPasswordEncoder(bcryptStrength), lookupSecret);
    }

    ApiKeyHasher(PasswordEncoder passwordEncoder, String lookupSecret) {
        if (lookupSecret == null || lookupSecret.isEmpty()) {
            throw new IllegalArgumentException("forgeflow.api-key.lookup-secret must be set");
        }
        this.passwordEncoder = passwordEncoder;
        this.lookupKey = new SecretKeySpec(lookupSecret.getBytes(StandardCharsets.UTF_8), LOOKUP_ALGORITHM);
    }

    /**
     * Slow salted hash stored as {@code key_hash}.
     */
    public String hash(String secret) {
        return passwordEncoder.encode(truncate(secret));
    }

    /**
     * Constant-time bcrypt comparison of a presented secret against a stored hash.
     */
    public boolean matches(String secret, String keyHash) {
        if (keyHash == null || keyHash.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(truncate(secret), keyHash);
    }

    /**
     * Deterministic keyed digest stored as {@code lookup_hash}, used to find candidate keys.
     */
    public String lookupDigest(String secret) {
        try {
            Mac mac = Mac.getInstance(LOOKUP_ALGORITHM);
            mac.init(lookupKey);
            return ApiKeyUtil.bytesToHex(mac.doFinal(truncate(secret).getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    /**
     * Truncate to at most {@link #MAX_SECRET_BYTES} bytes of UTF-8, backing off to the last
     * complete character so the result re-encodes to exactly the kept bytes.
     */
    public static String truncate(String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_SECRET_BYTES) {
            return secret;
        }
        int end = MAX_SECRET_BYTES;
        // bytes[end] is the first dropped byte; a continuation byte there means a character is split
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(Arrays.copyOf(bytes, end), StandardCharsets.UTF_8);
    }
}
