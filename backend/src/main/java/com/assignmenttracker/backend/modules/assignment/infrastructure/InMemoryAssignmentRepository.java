package com.assignmenttracker.backend.modules.assignment.infrastructure;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import com.assignmenttracker.backend.modules.assignment.domain.Assignment;

import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAssignmentRepository implements AssignmentRepository {

    private static final Comparator<Assignment> CREATION_ORDER =
            Comparator.comparing(Assignment::getCreatedAt).thenComparing(Assignment::getId);

    private final ConcurrentMap<UUID, Assignment> assignments = new ConcurrentHashMap<>();

    @Override
    public List<Assignment> findAll() {
        return assignments.values().stream()
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public List<Assignment> findByStudentId(UUID studentId) {
        return assignments.values().stream()
                .filter(assignment -> Objects.equals(assignment.getStudentId(), studentId))
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public Optional<Assignment> findById(UUID id) {
        return id == null ? Optional.empty() : Optional.ofNullable(assignments.get(id));
    }

    @Override
    public Assignment save(Assignment assignment) {
        Objects.requireNonNull(assignment.getId(), "assignment id must be assigned before save");
        assignments.put(assignment.getId(), assignment);
        return assignment;
    }

    @Override
    public Optional<Assignment> update(UUID id, UnaryOperator<Assignment> change) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(assignments.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public boolean deleteById(UUID id) {
        return id != null && assignments.remove(id) != null;
    }
}
