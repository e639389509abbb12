package com.assignmenttracker.backend.modules.student.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class Student {

    private UUID id;
    private String fullName;
    private String email;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
