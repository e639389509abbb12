package com.assignmenttracker.backend.modules.auth.infrastructure.jwt;

/**
 * The configured token signing key is unusable. Thrown while the application starts.
 */
public class SigningKeyInvalidException extends RuntimeException {

    public SigningKeyInvalidException(String message) {
        super(message);
    }

    public SigningKeyInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
