package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.service.EnrollmentResult;
import java.time.Instant;

/**
 * Response DTO for enrollment, drop and offer operations.
 *
 * @author Enrollment Team
 */
public class EnrollmentResultResponse {

    private String studentId;
    private String classId;
    private boolean success;
    private String status;
    private Integer position;
    private String reason;
    private String message;
    private Instant offerExpiresAt;

    public EnrollmentResultResponse() {
    }

    public static EnrollmentResultResponse fromResult(String studentId, String classId, EnrollmentResult result) {
        EnrollmentResultResponse response = new EnrollmentResultResponse();
        response.setStudentId(studentId);
        response.setClassId(classId);
        response.setSuccess(result.isSuccess());
        response.setStatus(result.getStatus() == null ? null : result.getStatus().name());
        response.setPosition(result.getPosition());
        response.setReason(result.getReason() == null ? null : result.getReason().name());
        response.setMessage(result.getMessage());
        response.setOfferExpiresAt(result.getOfferExpiresAt());
        return response;
    }

    // Getters and setters
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

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getOfferExpiresAt() {
        return offerExpiresAt;
    }

    public void setOfferExpiresAt(Instant offerExpiresAt) {
        this.offerExpiresAt = offerExpiresAt;
    }
}
