package com.assignmenttracker.backend.modules.assignment.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Coursework item, optionally assigned to a student. The student id is kept as posted.
 */
@Getter
@Setter
@NoArgsConstructor
public class Assignment {

    private UUID id;
    private String title;
    private String description;
    private LocalDate dueDate;
    private UUID studentId;
    private boolean completed;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
