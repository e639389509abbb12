package com.assignmenttracker.backend.modules.student.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.assignmenttracker.backend.modules.student.domain.Student;

import org.junit.jupiter.api.Test;

class InMemoryStudentRepositoryTest {

    private static final OffsetDateTime CREATED_AT = OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private final InMemoryStudentRepository repository = new InMemoryStudentRepository();

    @Test
    void updateChangesStoredStudentInPlace() {
        Student saved = repository.save(student("Ada"));

        assertThat(repository.update(saved.getId(), student -> {
            student.setFullName("Ada Lovelace");
            return student;
        })).map(Student::getFullName).contains("Ada Lovelace");
        assertThat(repository.findById(saved.getId())).map(Student::getFullName).contains("Ada Lovelace");
    }

    @Test
    void updateAfterDeleteDoesNotRestoreStudent() {
        Student saved = repository.save(student("Grace"));
        repository.deleteById(saved.getId());

        assertThat(repository.update(saved.getId(), student -> {
            student.setFullName("Grace Hopper");
            return student;
        })).isEmpty();
        assertThat(repository.findById(saved.getId())).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void updateOfNullIdIsEmpty() {
        assertThat(repository.update(null, student -> student)).isEmpty();
    }

    private static Student student(String fullName) {
        Student student = new Student();
        student.setId(UUID.randomUUID());
        student.setFullName(fullName);
        student.setCreatedAt(CREATED_AT);
        student.setUpdatedAt(CREATED_AT);
        return student;
    }
}
