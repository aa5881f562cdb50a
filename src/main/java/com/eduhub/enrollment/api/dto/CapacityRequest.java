package com.eduhub.enrollment.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for changing a class capacity.
 *
 * @author Enrollment Team
 */
public class CapacityRequest {

    @NotNull(message = "Capacity is required")
    @Min(value = 0, message = "Capacity must not be negative")
    private Integer capacity;

    public CapacityRequest() {
    }

    public CapacityRequest(Integer capacity) {
        this.capacity = capacity;
    }

    // Getters and setters
    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }
}
