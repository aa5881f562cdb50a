package com.eduhub.enrollment.exception;

import com.eduhub.enrollment.domain.model.FailureReason;

/**
 * Exception thrown when a waitlist offer response cannot be applied,
 * e.g. the student holds no outstanding offer.
 *
 * @author Enrollment Team
 */
public class WaitlistOfferException extends EnrollmentException {

    private final String studentId;
    private final String classId;

    public WaitlistOfferException(FailureReason reason, String studentId, String classId, String message) {
        super(reason, message);
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
