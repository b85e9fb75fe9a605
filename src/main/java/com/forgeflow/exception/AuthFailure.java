package com.forgeflow.exception;

/**
 * Reasons an API key authentication is rejected.
 */
public enum AuthFailure {
    MISSING_CREDENTIAL("Authorization header missing"),
    INVALID_OR_EXPIRED("Invalid or expired API key"),
    IDENTITY_MISSING("API key owner no longer exists");

    private final String detail;

    AuthFailure(String detail) {
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
