package com.forgeflow.exception;

/**
 * Exception thrown when a requested resource is not found or is not owned by the caller.
 * Both cases are reported identically.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Long identifier) {
        super(String.format("%s with identifier '%s' not found or access denied", resource, identifier));
    }
}
