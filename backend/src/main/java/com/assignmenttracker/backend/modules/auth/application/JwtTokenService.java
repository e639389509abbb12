package com.assignmenttracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import com.assignmenttracker.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies stateless access tokens whose subject is the username.
 */
@Service
public class JwtTokenService {

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:86400000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        if (accessTokenTtlMillis <= 0) {
            throw new IllegalArgumentException("jwt.expiration must be positive");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issue(String username) {
        // iat and exp are serialized as whole seconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiry = now.plusMillis(accessTokenTtlMillis).truncatedTo(ChronoUnit.SECONDS);

        String token = Jwts.builder()
                .subject(username)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(tokenProvider.getSecretKey(), tokenProvider.getAlgorithm())
                .compact();

        return new IssuedToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }

        String username = claims.getSubject();
        if (username == null || username.isBlank()) {
            throw new InvalidTokenException("Access token has no subject", null);
        }
        if (claims.getExpiration() == null) {
            throw new InvalidTokenException("Access token has no expiry", null);
        }
        Instant expiresAt = claims.getExpiration().toInstant();
        // the parser accepts a token at its exact expiry second; the window is half-open
        if (!clock.instant().isBefore(expiresAt)) {
            throw new InvalidTokenException("Access token expired", null);
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : expiresAt;

        return new ParsedToken(
                username,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record IssuedToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(String username, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
