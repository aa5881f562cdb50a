package com.eduhub.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit trail of enrollment and waitlist transitions.
 * Written in the same transaction as the change it describes.
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "enrollment_audit_log", indexes = {
    @Index(name = "idx_audit_class_time", columnList = "class_id, occurred_at"),
    @Index(name = "idx_audit_student", columnList = "student_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentAuditLog {

    @Id
    @Column(name = "audit_id", nullable = false, length = 36)
    private String auditId;

    /**
     * Null for class-level actions such as CAPACITY_CHANGED.
     */
    @Column(name = "student_id", length = 64)
    private String studentId;

    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 30)
    private AuditAction action;

    @Column(name = "previous_status", length = 20)
    private String previousStatus;

    @Column(name = "new_status", length = 20)
    private String newStatus;

    @Column(name = "reason", length = 255)
    private String reason;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (auditId == null) {
            auditId = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public enum AuditAction {
        ENROLLED,
        WAITLISTED,
        DROPPED,
        DENIED,
        OFFERED,
        OFFER_ACCEPTED,
        OFFER_DECLINED,
        OFFER_EXPIRED,
        CAPACITY_CHANGED
    }
}
