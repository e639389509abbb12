package com.assignmenttracker.backend.modules.auth.application;

/**
 * Raised when a stored digest or salt is missing or empty. Indicates corrupted
 * credential data rather than a wrong password.
 */
public class InvalidCredentialDataException extends RuntimeException {

    public InvalidCredentialDataException(String message) {
        super(message);
    }
}
