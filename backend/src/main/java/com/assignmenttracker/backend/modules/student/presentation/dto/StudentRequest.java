package com.assignmenttracker.backend.modules.student.presentation.dto;

public record StudentRequest(String fullName, String email) {
}
