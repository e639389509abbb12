package com.assignmenttracker.backend.modules.student.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.assignmenttracker.backend.global.error.ProblemException;
import com.assignmenttracker.backend.modules.student.domain.Student;
import com.assignmenttracker.backend.modules.student.infrastructure.StudentRepository;
import com.assignmenttracker.backend.modules.student.presentation.dto.StudentRequest;
import com.assignmenttracker.backend.modules.student.presentation.dto.StudentResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class StudentService {

    static final String STUDENT_NOT_FOUND = "STUDENT_NOT_FOUND";

    private final StudentRepository studentRepository;
    private final Clock clock;

    public StudentService(StudentRepository studentRepository, Clock clock) {
        this.studentRepository = studentRepository;
        this.clock = clock;
    }

    public List<StudentResponse> getStudents() {
        return studentRepository.findAll().stream()
                .map(StudentResponse::from)
                .toList();
    }

    public StudentResponse getStudent(UUID studentId) {
        return StudentResponse.from(loadStudent(studentId));
    }

    public StudentResponse createStudent(StudentRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Student student = new Student();
        student.setId(UUID.randomUUID());
        student.setFullName(request.fullName());
        student.setEmail(request.email());
        student.setCreatedAt(now);
        student.setUpdatedAt(now);
        return StudentResponse.from(studentRepository.save(student));
    }

    public StudentResponse updateStudent(UUID studentId, StudentRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return studentRepository.update(studentId, student -> {
                    student.setFullName(request.fullName());
                    student.setEmail(request.email());
                    student.setUpdatedAt(now);
                    return student;
                })
                .map(StudentResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, STUDENT_NOT_FOUND));
    }

    public void deleteStudent(UUID studentId) {
        if (!studentRepository.deleteById(studentId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, STUDENT_NOT_FOUND);
        }
    }

    private Student loadStudent(UUID studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, STUDENT_NOT_FOUND));
    }
}
