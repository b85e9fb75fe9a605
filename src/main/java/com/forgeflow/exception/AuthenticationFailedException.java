package com.forgeflow.exception;

/**
 * Exception thrown when a bearer API key cannot be resolved to a user.
 */
public class AuthenticationFailedException extends RuntimeException {

    private final AuthFailure failure;

    public AuthenticationFailedException(AuthFailure failure) {
        super(failure.getDetail());
        this.failure = failure;
    }

    public AuthFailure getFailure() {
        return failure;
    }
}
