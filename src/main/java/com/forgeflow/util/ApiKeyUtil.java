package com.forgeflow.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for API key generation.
 */
public class ApiKeyUtil {

    private static final String API_KEY_PREFIX = "ff_";
    private static final int KEY_LENGTH = 32;
    private static final int DISPLAY_PREFIX_LENGTH = 7;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ApiKeyUtil() {
    }

    /**
     * Generate a new API key with ff_ prefix.
     *
     * @return Generated API key (e.g., ff_abc123...)
     */
    public static String generateApiKey() {
        return API_KEY_PREFIX + randomToken();
    }

    /**
     * Random URL-safe token with {@value #KEY_LENGTH} bytes of entropy.
     */
    public static String randomToken() {
        byte[] randomBytes = new byte[KEY_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Get the display prefix of an API key (first 7 characters).
     * Lets a holder recognise a key in listings without revealing it.
     *
     * @param apiKey The API key
     * @return Key prefix (e.g., ff_abc1)
     */
    public static String getKeyPrefix(String apiKey) {
        if (apiKey == null || apiKey.length() < DISPLAY_PREFIX_LENGTH) {
            return "";
        }
        return apiKey.substring(0, DISPLAY_PREFIX_LENGTH);
    }

    /**
     * Convert byte array to hex string.
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
