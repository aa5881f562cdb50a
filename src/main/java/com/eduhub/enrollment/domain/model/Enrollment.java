package com.eduhub.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * One student's admission record for one class.
 *
 * Lifecycle:
 * - PENDING: request received (transient)
 * - ENROLLED: seat reserved
 * - WAITLISTED: class full, queued
 * - DROPPED: left the class or the queue (terminal)
 * - DENIED: rejected by policy (terminal)
 *
 * Records are never deleted; terminal rows stay for audit.
 * At most one active (PENDING, ENROLLED, WAITLISTED) row exists per (studentId, classId).
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "enrollments", indexes = {
    @Index(name = "idx_enrollment_student_class", columnList = "student_id, class_id"),
    @Index(name = "idx_enrollment_class_status", columnList = "class_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Enrollment {

    public static final Set<EnrollmentStatus> ACTIVE_STATUSES =
            EnumSet.of(EnrollmentStatus.PENDING, EnrollmentStatus.ENROLLED, EnrollmentStatus.WAITLISTED);

    public static final String REASON_STUDENT_DROP = "STUDENT_DROP";
    public static final String REASON_OFFER_DECLINED = "OFFER_DECLINED";
    public static final String REASON_OFFER_EXPIRED = "OFFER_EXPIRED";

    @Id
    @Column(name = "enrollment_id", nullable = false, length = 36)
    private String enrollmentId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EnrollmentStatus status;

    /**
     * Optional note supplied by the student with the request.
     */
    @Column(name = "justification", length = 1000)
    private String justification;

    /**
     * Why the record reached its current terminal status, e.g. OFFER_EXPIRED.
     */
    @Column(name = "status_reason", length = 40)
    private String statusReason;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    /**
     * When the request left PENDING (enrolled, waitlisted or denied).
     */
    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "dropped_at")
    private Instant droppedAt;

    @PrePersist
    protected void onCreate() {
        if (enrollmentId == null) {
            enrollmentId = UUID.randomUUID().toString();
        }
        if (requestedAt == null) {
            requestedAt = Instant.now();
        }
        if (status == null) {
            status = EnrollmentStatus.PENDING;
        }
    }

    public boolean isActive() {
        return status != null && ACTIVE_STATUSES.contains(status);
    }

    /**
     * Seat granted, directly or by accepting a waitlist offer.
     */
    public void enroll(Instant at) {
        transitionTo(EnrollmentStatus.ENROLLED);
        decidedAt = at;
    }

    public void waitlist(Instant at) {
        transitionTo(EnrollmentStatus.WAITLISTED);
        decidedAt = at;
    }

    public void drop(String reason, Instant at) {
        transitionTo(EnrollmentStatus.DROPPED);
        this.statusReason = reason;
        this.droppedAt = at;
    }

    private void transitionTo(EnrollmentStatus target) {
        EnrollmentStatus current = status == null ? EnrollmentStatus.PENDING : status;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal enrollment transition " + current + " -> " + target + " for " + studentId + "/" + classId);
        }
        this.status = target;
    }
}
