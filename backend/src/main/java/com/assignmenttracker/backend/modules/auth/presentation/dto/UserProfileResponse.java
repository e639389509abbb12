package com.assignmenttracker.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.assignmenttracker.backend.modules.auth.domain.UserCredential;

public record UserProfileResponse(String username, OffsetDateTime registeredAt) {

    public static UserProfileResponse from(UserCredential credential) {
        return new UserProfileResponse(credential.getUsername(), credential.getRegisteredAt());
    }
}
