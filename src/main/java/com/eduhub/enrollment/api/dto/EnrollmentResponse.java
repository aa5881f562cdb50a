package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.Enrollment;
import java.time.Instant;

/**
 * Response DTO for an enrollment record.
 *
 * @author Enrollment Team
 */
public class EnrollmentResponse {

    private String enrollmentId;
    private String studentId;
    private String classId;
    private String status;
    private String statusReason;
    private Instant requestedAt;
    private Instant decidedAt;
    private Instant droppedAt;

    public EnrollmentResponse() {
    }

    public static EnrollmentResponse fromEntity(Enrollment enrollment) {
        EnrollmentResponse response = new EnrollmentResponse();
        response.setEnrollmentId(enrollment.getEnrollmentId());
        response.setStudentId(enrollment.getStudentId());
        response.setClassId(enrollment.getClassId());
        response.setStatus(enrollment.getStatus().name());
        response.setStatusReason(enrollment.getStatusReason());
        response.setRequestedAt(enrollment.getRequestedAt());
        response.setDecidedAt(enrollment.getDecidedAt());
        response.setDroppedAt(enrollment.getDroppedAt());
        return response;
    }

    // Getters and setters
    public String getEnrollmentId() {
        return enrollmentId;
    }

    public void setEnrollmentId(String enrollmentId) {
        this.enrollmentId = enrollmentId;
    }

    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public String getClassId() {
        return classId;
    }

    public void setClassId(String classId) {
        this.classId = classId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getStatusReason() {
        return statusReason;
    }

    public void setStatusReason(String statusReason) {
        this.statusReason = statusReason;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public void setDecidedAt(Instant decidedAt) {
        this.decidedAt = decidedAt;
    }

    public Instant getDroppedAt() {
        return droppedAt;
    }

    public void setDroppedAt(Instant droppedAt) {
        this.droppedAt = droppedAt;
    }
}
