package com.assignmenttracker.backend.modules.student.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.assignmenttracker.backend.modules.student.domain.Student;

public record StudentResponse(
        UUID id,
        String fullName,
        String email,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static StudentResponse from(Student student) {
        return new StudentResponse(
                student.getId(),
                student.getFullName(),
                student.getEmail(),
                student.getCreatedAt(),
                student.getUpdatedAt()
        );
    }
}
