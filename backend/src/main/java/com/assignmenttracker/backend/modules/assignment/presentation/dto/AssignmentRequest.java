package com.assignmenttracker.backend.modules.assignment.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

public record AssignmentRequest(
        String title,
        String description,
        LocalDate dueDate,
        UUID studentId,
        Boolean completed
) {
}
