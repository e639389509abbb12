package com.assignmenttracker.backend.modules.student.infrastructure;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import com.assignmenttracker.backend.modules.student.domain.Student;

import org.springframework.stereotype.Repository;

@Repository
public class InMemoryStudentRepository implements StudentRepository {

    private final ConcurrentMap<UUID, Student> students = new ConcurrentHashMap<>();

    @Override
    public List<Student> findAll() {
        return students.values().stream()
                .sorted(Comparator.comparing(Student::getCreatedAt).thenComparing(Student::getId))
                .toList();
    }

    @Override
    public Optional<Student> findById(UUID id) {
        return id == null ? Optional.empty() : Optional.ofNullable(students.get(id));
    }

    @Override
    public Student save(Student student) {
        Objects.requireNonNull(student.getId(), "student id must be assigned before save");
        students.put(student.getId(), student);
        return student;
    }

    @Override
    public Optional<Student> update(UUID id, UnaryOperator<Student> change) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(students.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public boolean deleteById(UUID id) {
        return id != null && students.remove(id) != null;
    }
}
