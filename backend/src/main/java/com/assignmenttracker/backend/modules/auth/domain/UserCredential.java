package com.assignmenttracker.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

import lombok.Getter;

/**
 * Registered user and the password digest derived at registration. Immutable.
 */
@Getter
public final class UserCredential {

    private final String username;
    private final DerivedCredential credential;
    private final OffsetDateTime registeredAt;

    public UserCredential(String username, DerivedCredential credential, OffsetDateTime registeredAt) {
        this.username = Objects.requireNonNull(username, "username");
        this.credential = Objects.requireNonNull(credential, "credential");
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");
    }

    public byte[] getPasswordHash() {
        return credential.digest();
    }

    public byte[] getPasswordSalt() {
        return credential.salt();
    }

    @Override
    public String toString() {
        return "UserCredential[username=" + username + ", registeredAt=" + registeredAt + "]";
    }
}
