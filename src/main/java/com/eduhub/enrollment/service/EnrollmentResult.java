package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;

import java.time.Instant;

/**
 * Outcome of a coordinator operation.
 * Core operations never throw to the transport; they return one of these.
 *
 * @author Enrollment Team
 */
public final class EnrollmentResult {

    private final boolean success;
    private final EnrollmentStatus status;
    private final Integer position;
    private final FailureReason reason;
    private final String message;
    private final Instant offerExpiresAt;
    private final CapacitySnapshot snapshot;

    private EnrollmentResult(boolean success, EnrollmentStatus status, Integer position, FailureReason reason,
                             String message, Instant offerExpiresAt, CapacitySnapshot snapshot) {
        this.success = success;
        this.status = status;
        this.position = position;
        this.reason = reason;
        this.message = message;
        this.offerExpiresAt = offerExpiresAt;
        this.snapshot = snapshot;
    }

    public static EnrollmentResult enrolled(String message) {
        return new EnrollmentResult(true, EnrollmentStatus.ENROLLED, null, null, message, null, null);
    }

    public static EnrollmentResult waitlisted(int position, String message) {
        return new EnrollmentResult(true, EnrollmentStatus.WAITLISTED, position, null, message, null, null);
    }

    public static EnrollmentResult dropped(String message) {
        return new EnrollmentResult(true, EnrollmentStatus.DROPPED, null, null, message, null, null);
    }

    /**
     * Success without a status change, e.g. dropping an enrollment that does not exist.
     */
    public static EnrollmentResult noChange(EnrollmentStatus status, String message) {
        return new EnrollmentResult(true, status, null, null, message, null, null);
    }

    /**
     * Success carrying a class snapshot (class creation, capacity changes).
     */
    public static EnrollmentResult ofSnapshot(CapacitySnapshot snapshot, String message) {
        return new EnrollmentResult(true, null, null, null, message, null, snapshot);
    }

    /**
     * Duplicate requests and requests finding no room on the waitlist are
     * denied; every other reason leaves status unset.
     */
    public static EnrollmentResult failure(FailureReason reason, String message) {
        EnrollmentStatus status = reason == FailureReason.DUPLICATE_REQUEST || reason == FailureReason.WAITLIST_FULL
                ? EnrollmentStatus.DENIED
                : null;
        return new EnrollmentResult(false, status, null, reason, message, null, null);
    }

    /**
     * @return copy of this result carrying the deadline of an offer still held by the student
     */
    public EnrollmentResult withOfferExpiresAt(Instant expiresAt) {
        return new EnrollmentResult(success, status, position, reason, message, expiresAt, snapshot);
    }

    public boolean isSuccess() {
        return success;
    }

    public EnrollmentStatus getStatus() {
        return status;
    }

    public Integer getPosition() {
        return position;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOfferExpiresAt() {
        return offerExpiresAt;
    }

    public CapacitySnapshot getSnapshot() {
        return snapshot;
    }

    @Override
    public String toString() {
        return "EnrollmentResult{" +
                "success=" + success +
                ", status=" + status +
                ", position=" + position +
                ", reason=" + reason +
                ", message='" + message + '\'' +
                '}';
    }
}
