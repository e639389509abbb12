package com.assignmenttracker.backend.modules.assignment.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.assignmenttracker.backend.global.error.ProblemException;
import com.assignmenttracker.backend.modules.assignment.domain.Assignment;
import com.assignmenttracker.backend.modules.assignment.infrastructure.AssignmentRepository;
import com.assignmenttracker.backend.modules.assignment.presentation.dto.AssignmentRequest;
import com.assignmenttracker.backend.modules.assignment.presentation.dto.AssignmentResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class AssignmentService {

    static final String ASSIGNMENT_NOT_FOUND = "ASSIGNMENT_NOT_FOUND";

    private final AssignmentRepository assignmentRepository;
    private final Clock clock;

    public AssignmentService(AssignmentRepository assignmentRepository, Clock clock) {
        this.assignmentRepository = assignmentRepository;
        this.clock = clock;
    }

    public List<AssignmentResponse> getAssignments(UUID studentId) {
        List<Assignment> assignments = studentId == null
                ? assignmentRepository.findAll()
                : assignmentRepository.findByStudentId(studentId);
        return assignments.stream()
                .map(AssignmentResponse::from)
                .toList();
    }

    public AssignmentResponse getAssignment(UUID assignmentId) {
        return AssignmentResponse.from(loadAssignment(assignmentId));
    }

    public AssignmentResponse createAssignment(AssignmentRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Assignment assignment = new Assignment();
        assignment.setId(UUID.randomUUID());
        apply(assignment, request);
        assignment.setCreatedAt(now);
        assignment.setUpdatedAt(now);
        return AssignmentResponse.from(assignmentRepository.save(assignment));
    }

    public AssignmentResponse updateAssignment(UUID assignmentId, AssignmentRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return assignmentRepository.update(assignmentId, assignment -> {
                    apply(assignment, request);
                    assignment.setUpdatedAt(now);
                    return assignment;
                })
                .map(AssignmentResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ASSIGNMENT_NOT_FOUND));
    }

    public void deleteAssignment(UUID assignmentId) {
        if (!assignmentRepository.deleteById(assignmentId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, ASSIGNMENT_NOT_FOUND);
        }
    }

    private void apply(Assignment assignment, AssignmentRequest request) {
        assignment.setTitle(request.title());
        assignment.setDescription(request.description());
        assignment.setDueDate(request.dueDate());
        assignment.setStudentId(request.studentId());
        assignment.setCompleted(Boolean.TRUE.equals(request.completed()));
    }

    private Assignment loadAssignment(UUID assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ASSIGNMENT_NOT_FOUND));
    }
}
