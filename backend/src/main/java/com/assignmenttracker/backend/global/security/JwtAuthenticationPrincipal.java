package com.assignmenttracker.backend.global.security;

import java.time.OffsetDateTime;

public record JwtAuthenticationPrincipal(String username, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
}
