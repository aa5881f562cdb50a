package com.eduhub.enrollment.exception;

import com.eduhub.enrollment.domain.model.FailureReason;

/**
 * Exception thrown when a student already holds an active enrollment for a class.
 *
 * @author Enrollment Team
 */
public class DuplicateEnrollmentException extends EnrollmentException {

    private final String studentId;
    private final String classId;

    public DuplicateEnrollmentException(String studentId, String classId) {
        super(FailureReason.DUPLICATE_REQUEST,
                String.format("Student %s already has an active enrollment for class %s", studentId, classId));
        this.studentId = studentId;
        this.classId = classId;
    }

    public String getStudentId() {
        return studentId;
    }

    public String getClassId() {
        return classId;
    }
}
