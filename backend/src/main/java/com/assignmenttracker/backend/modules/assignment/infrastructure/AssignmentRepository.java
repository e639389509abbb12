package com.assignmenttracker.backend.modules.assignment.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

import com.assignmenttracker.backend.modules.assignment.domain.Assignment;

public interface AssignmentRepository {

    List<Assignment> findAll();

    List<Assignment> findByStudentId(UUID studentId);

    Optional<Assignment> findById(UUID id);

    Assignment save(Assignment assignment);

    /**
     * Applies {@code change} to the stored assignment atomically. Returns empty, and stores nothing, when the id is
     * absent at the time of the update.
     */
    Optional<Assignment> update(UUID id, UnaryOperator<Assignment> change);

    boolean deleteById(UUID id);
}
