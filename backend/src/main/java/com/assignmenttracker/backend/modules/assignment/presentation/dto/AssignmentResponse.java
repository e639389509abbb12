package com.assignmenttracker.backend.modules.assignment.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.assignmenttracker.backend.modules.assignment.domain.Assignment;

public record AssignmentResponse(
        UUID id,
        String title,
        String description,
        LocalDate dueDate,
        UUID studentId,
        boolean completed,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AssignmentResponse from(Assignment assignment) {
        return new AssignmentResponse(
                assignment.getId(),
                assignment.getTitle(),
                assignment.getDescription(),
                assignment.getDueDate(),
                assignment.getStudentId(),
                assignment.isCompleted(),
                assignment.getCreatedAt(),
                assignment.getUpdatedAt()
        );
    }
}
