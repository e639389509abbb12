package com.assignmenttracker.backend.modules.student.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

import com.assignmenttracker.backend.modules.student.domain.Student;

public interface StudentRepository {

    List<Student> findAll();

    Optional<Student> findById(UUID id);

    Student save(Student student);

    /**
     * Applies {@code change} to the stored student atomically. Returns empty, and stores nothing, when the id is
     * absent at the time of the update.
     */
    Optional<Student> update(UUID id, UnaryOperator<Student> change);

    boolean deleteById(UUID id);
}
