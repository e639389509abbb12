package com.assignmenttracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.assignmenttracker.backend.global.error.ProblemException;
import com.assignmenttracker.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.assignmenttracker.backend.modules.auth.domain.DerivedCredential;
import com.assignmenttracker.backend.modules.auth.domain.UserCredential;
import com.assignmenttracker.backend.modules.auth.infrastructure.IdentityAlreadyExistsException;
import com.assignmenttracker.backend.modules.auth.infrastructure.UserCredentialRepository;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.assignmenttracker.backend.modules.auth.presentation.dto.RegisterRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    static final String IDENTITY_ALREADY_EXISTS = "IDENTITY_ALREADY_EXISTS";
    static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final UserCredentialRepository userCredentialRepository;
    private final CredentialService credentialService;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;
    private final DerivedCredential unknownUserCredential;

    public AuthService(
            UserCredentialRepository userCredentialRepository,
            CredentialService credentialService,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.userCredentialRepository = userCredentialRepository;
        this.credentialService = credentialService;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
        this.unknownUserCredential = credentialService.derive("unknown-user-placeholder");
    }

    public UserProfileResponse register(RegisterRequest request) {
        String username = request.username().trim();
        DerivedCredential derived = credentialService.derive(request.password());
        UserCredential credential = new UserCredential(username, derived, OffsetDateTime.now(clock));
        try {
            userCredentialRepository.insert(credential);
        } catch (IdentityAlreadyExistsException ex) {
            log.debug("Registration rejected: {} is taken", ex.getUsername());
            throw new ProblemException(HttpStatus.CONFLICT, IDENTITY_ALREADY_EXISTS);
        }
        log.info("Registered user {}", username);
        return UserProfileResponse.from(credential);
    }

    public LoginResponse login(LoginRequest request) {
        UserCredential user = userCredentialRepository.findByUsername(request.username().trim()).orElse(null);

        if (user == null) {
            // same hashing cost as a real check so response time does not reveal unknown usernames
            credentialService.verify(request.password(), unknownUserCredential);
            log.debug("Login rejected: unknown username");
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS);
        }

        if (!credentialService.verify(request.password(), user.getCredential())) {
            log.debug("Login rejected: password mismatch for {}", user.getUsername());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS);
        }

        IssuedToken issued = jwtTokenService.issue(user.getUsername());
        return new LoginResponse(
                issued.token(),
                LoginResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtlMillis() / 1000L,
                issued.issuedAt(),
                issued.expiresAt(),
                user.getUsername()
        );
    }

    public UserProfileResponse loadProfile(String username) {
        return userCredentialRepository.findByUsername(username)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, USER_NOT_FOUND));
    }

    public List<UserProfileResponse> listUsers() {
        return userCredentialRepository.findAll().stream()
                .map(UserProfileResponse::from)
                .toList();
    }
}
