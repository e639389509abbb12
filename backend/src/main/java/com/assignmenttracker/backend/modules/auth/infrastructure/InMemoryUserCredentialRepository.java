package com.assignmenttracker.backend.modules.auth.infrastructure;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.assignmenttracker.backend.modules.auth.domain.UserCredential;

import org.springframework.stereotype.Repository;

/**
 * Process-local credential store. Usernames are compared case-insensitively.
 */
@Repository
public class InMemoryUserCredentialRepository implements UserCredentialRepository {

    private final ConcurrentMap<String, UserCredential> credentials = new ConcurrentHashMap<>();

    @Override
    public Optional<UserCredential> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(credentials.get(normalize(username)));
    }

    @Override
    public UserCredential insert(UserCredential credential) {
        UserCredential existing = credentials.putIfAbsent(normalize(credential.getUsername()), credential);
        if (existing != null) {
            throw new IdentityAlreadyExistsException(credential.getUsername());
        }
        return credential;
    }

    @Override
    public List<UserCredential> findAll() {
        return credentials.values().stream()
                .sorted(Comparator.comparing(UserCredential::getRegisteredAt)
                        .thenComparing(UserCredential::getUsername))
                .toList();
    }

    private static String normalize(String username) {
        return username.trim().toLowerCase(Locale.ROOT);
    }
}
