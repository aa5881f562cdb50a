package com.eduhub.enrollment.exception;

import com.eduhub.enrollment.domain.model.FailureReason;

/**
 * Raised by the HTTP layer when a coordinator operation returns a failure result,
 * so the failure reaches the client through the global exception handler.
 *
 * Common reasons:
 * - DUPLICATE_REQUEST: active enrollment already exists
 * - CLASS_NOT_FOUND: unknown class
 * - NO_OUTSTANDING_OFFER / OFFER_EXPIRED: offer response could not be applied
 * - STORAGE_FAILURE: nothing was changed, the client may retry
 *
 * @author Enrollment Team
 */
public class EnrollmentRejectedException extends RuntimeException {

    private final FailureReason reason;
    private final String studentId;
    private final String classId;

    public EnrollmentRejectedException(FailureReason reason, String message, String studentId, String classId) {
        super(message);
        this.reason = reason;
        this.studentId = studentId;
        this.classId = classId;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getStudentId() {
        return studentId;
    }

    public String getClassId() {
        return classId;
    }
}
