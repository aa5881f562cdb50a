package com.eduhub.enrollment.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Request DTO for registering a class and its capacity.
 *
 * @author Enrollment Team
 */
public class CreateClassRequest {

    @NotBlank(message = "Class ID is required")
    @Pattern(regexp = "[A-Za-z0-9._:-]{1,64}", message = "Class ID must be 1-64 characters of letters, digits, . _ : -")
    private String classId;

    @NotNull(message = "Capacity is required")
    @Min(value = 0, message = "Capacity must not be negative")
    private Integer capacity;

    /**
     * Optional; the configured default applies when absent.
     */
    @Min(value = 0, message = "Waitlist capacity must not be negative")
    private Integer waitlistCapacity;

    @Pattern(regexp = "[A-Za-z0-9._:-]{1,64}", message = "Teacher ID must be 1-64 characters of letters, digits, . _ : -")
    private String teacherId;

    public CreateClassRequest() {
    }

    public CreateClassRequest(String classId, Integer capacity, String teacherId) {
        this.classId = classId;
        this.capacity = capacity;
        this.teacherId = teacherId;
    }

    // Getters and setters
    public String getClassId() {
        return classId;
    }

    public void setClassId(String classId) {
        this.classId = classId;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getWaitlistCapacity() {
        return waitlistCapacity;
    }

    public void setWaitlistCapacity(Integer waitlistCapacity) {
        this.waitlistCapacity = waitlistCapacity;
    }

    public String getTeacherId() {
        return teacherId;
    }

    public void setTeacherId(String teacherId) {
        this.teacherId = teacherId;
    }
}
