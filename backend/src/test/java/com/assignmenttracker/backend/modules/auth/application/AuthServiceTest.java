package com.assignmenttracker.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.assignmenttracker.backend.global.error.ProblemException;
import com.assignmenttracker.backend.modules.auth.domain.DerivedCredential;
import com.assignmenttracker.backend.modules.auth.domain.UserCredential;
import com.assignmenttracker.backend.modules.auth.infrastructure.InMemoryUserCredentialRepository;
import com.assignmenttracker.backend.modules.auth.infrastructure.UserCredentialRepository;
import com.assignmenttracker.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.assignmenttracker.backend.modules.auth.presentation.dto.RegisterRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;

class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final long TTL_MILLIS = 86_400_000L;

    private Clock clock;
    private CredentialService credentialService;
    private JwtTokenService jwtTokenService;
    private InMemoryUserCredentialRepository repository;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        credentialService = new CredentialService(new SecureRandom());
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef"),
                TTL_MILLIS,
                clock
        );
        repository = new InMemoryUserCredentialRepository();
        authService = new AuthService(repository, credentialService, jwtTokenService, clock);
    }

    @Test
    void registerStoresDerivedCredentialNotPassword() {
        UserProfileResponse registered = authService.register(new RegisterRequest("alice", "password"));

        assertThat(registered.username()).isEqualTo("alice");
        assertThat(registered.registeredAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));

        UserCredential stored = repository.findByUsername("alice").orElseThrow();
        assertThat(stored.getPasswordHash()).hasSize(64);
        assertThat(stored.getPasswordSalt()).isNotEmpty();
        assertThat(credentialService.verify("password", stored.getCredential())).isTrue();
    }

    @Test
    void loginIssuesBearerTokenForRegisteredUser() {
        authService.register(new RegisterRequest("alice", "password"));

        LoginResponse response = authService.login(new LoginRequest("alice", "password"));

        assertThat(response.tokenType()).isEqualTo("Bearer");
        assertThat(response.username()).isEqualTo("alice");
        assertThat(response.expiresIn()).isEqualTo(TTL_MILLIS / 1000L);
        assertThat(response.expiresAt()).isEqualTo(response.issuedAt().plusSeconds(TTL_MILLIS / 1000L));
        assertThat(jwtTokenService.parseAccessToken(response.accessToken()).username()).isEqualTo("alice");
    }

    @Test
    void loginAcceptsDifferentlyCasedUsernameAndKeepsRegisteredSpelling() {
        authService.register(new RegisterRequest("Alice", "password"));

        LoginResponse response = authService.login(new LoginRequest("  alice ", "password"));

        assertThat(response.username()).isEqualTo("Alice");
    }

    @Test
    void duplicateRegistrationIsConflict() {
        authService.register(new RegisterRequest("alice", "password"));

        ProblemException exception = assertThrows(
                ProblemException.class,
                () -> authService.register(new RegisterRequest("ALICE", "other"))
        );

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(exception.getCode()).isEqualTo(AuthService.IDENTITY_ALREADY_EXISTS);
        assertThat(credentialService.verify("password", repository.findByUsername("alice").orElseThrow().getCredential()))
                .isTrue();
    }

    @Test
    @DisplayName("unknown username and wrong password fail the same way")
    void loginFailuresAreIndistinguishable() {
        authService.register(new RegisterRequest("alice", "password"));

        ProblemException wrongPassword = assertThrows(
                ProblemException.class,
                () -> authService.login(new LoginRequest("alice", "wrong"))
        );
        ProblemException unknownUser = assertThrows(
                ProblemException.class,
                () -> authService.login(new LoginRequest("bob", "password"))
        );

        assertThat(wrongPassword.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(unknownUser.getStatusCode()).isEqualTo(wrongPassword.getStatusCode());
        assertThat(unknownUser.getCode()).isEqualTo(AuthService.INVALID_CREDENTIALS);
        assertThat(unknownUser.getCode()).isEqualTo(wrongPassword.getCode());
        assertThat(unknownUser.getDetailMessage()).isEqualTo(wrongPassword.getDetailMessage());
    }

    @Test
    void corruptedStoredCredentialSurfacesAsDataError() {
        UserCredentialRepository corrupted = Mockito.mock(UserCredentialRepository.class);
        UserCredential broken = new UserCredential(
                "alice",
                new DerivedCredential(new byte[0], new byte[0]),
                OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)
        );
        when(corrupted.findByUsername("alice")).thenReturn(Optional.of(broken));
        AuthService service = new AuthService(corrupted, credentialService, jwtTokenService, clock);

        assertThatThrownBy(() -> service.login(new LoginRequest("alice", "password")))
                .isInstanceOf(InvalidCredentialDataException.class);
    }

    @Test
    void loadProfileOfUnknownUserIsNotFound() {
        ProblemException exception = assertThrows(
                ProblemException.class,
                () -> authService.loadProfile("ghost")
        );

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(exception.getCode()).isEqualTo(AuthService.USER_NOT_FOUND);
    }

    @Test
    void listUsersReturnsRegisteredUsernamesOnly() {
        authService.register(new RegisterRequest("bob", "password"));
        authService.register(new RegisterRequest("alice", "password"));

        assertThat(authService.listUsers())
                .extracting(UserProfileResponse::username)
                .containsExactly("alice", "bob");
    }
}
