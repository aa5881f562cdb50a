package com.eduhub.enrollment.exception;

import com.eduhub.enrollment.domain.model.FailureReason;

/**
 * Business rule violation raised inside the enrollment core.
 * The coordinator rolls back the operation and reports the reason as a result.
 *
 * @author Enrollment Team
 */
public class EnrollmentException extends RuntimeException {

    private final FailureReason reason;

    public EnrollmentException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
