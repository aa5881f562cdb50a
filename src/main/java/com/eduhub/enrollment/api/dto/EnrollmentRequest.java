package com.eduhub.enrollment.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for an enrollment request. The class comes from the path.
 *
 * @author Enrollment Team
 */
public class EnrollmentRequest {

    @NotBlank(message = "Student ID is required")
    @Pattern(regexp = "[A-Za-z0-9._:-]{1,64}", message = "Student ID must be 1-64 characters of letters, digits, . _ : -")
    private String studentId;

    @Size(max = 1000, message = "Justification must be at most 1000 characters")
    private String justification;

    public EnrollmentRequest() {
    }

    public EnrollmentRequest(String studentId, String justification) {
        this.studentId = studentId;
        this.justification = justification;
    }

    // Getters and setters
    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }
}
