package com.assignmenttracker.backend.modules.auth.infrastructure;

import java.util.List;
import java.util.Optional;

import com.assignmenttracker.backend.modules.auth.domain.UserCredential;

/**
 * Storage for registered credentials. Implementations must keep concurrent
 * inserts for distinct usernames independent of each other.
 */
public interface UserCredentialRepository {

    Optional<UserCredential> findByUsername(String username);

    /**
     * @throws IdentityAlreadyExistsException when the username is already registered
     */
    UserCredential insert(UserCredential credential);

    List<UserCredential> findAll();
}
