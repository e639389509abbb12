package com.assignmenttracker.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt,
        String username
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
