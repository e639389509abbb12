package com.assignmenttracker.backend.modules.auth.infrastructure;

public class IdentityAlreadyExistsException extends RuntimeException {

    private final String username;

    public IdentityAlreadyExistsException(String username) {
        super("Identity already registered: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
