package com.assignmenttracker.backend.support;

import com.assignmenttracker.backend.modules.auth.application.AuthService;
import com.assignmenttracker.backend.modules.auth.infrastructure.UserCredentialRepository;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.RegisterRequest;

import org.springframework.stereotype.Component;

/**
 * Registers users in the shared application context and hands out access tokens.
 */
@Component
public class TestUserFactory {

    private final AuthService authService;
    private final UserCredentialRepository userCredentialRepository;

    public TestUserFactory(AuthService authService, UserCredentialRepository userCredentialRepository) {
        this.authService = authService;
        this.userCredentialRepository = userCredentialRepository;
    }

    public void ensureUser(String username, String password) {
        if (userCredentialRepository.findByUsername(username).isEmpty()) {
            authService.register(new RegisterRequest(username, password));
        }
    }

    public String bearerToken(String username, String password) {
        ensureUser(username, password);
        return "Bearer " + authService.login(new LoginRequest(username, password)).accessToken();
    }
}
