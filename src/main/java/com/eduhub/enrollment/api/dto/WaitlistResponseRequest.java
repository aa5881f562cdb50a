package com.eduhub.enrollment.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request DTO for answering a waitlist offer.
 *
 * @author Enrollment Team
 */
public class WaitlistResponseRequest {

    @NotBlank(message = "Response is required")
    @Pattern(regexp = "(?i)ACCEPT|DECLINE", message = "Response must be ACCEPT or DECLINE")
    private String response;

    public WaitlistResponseRequest() {
    }

    public WaitlistResponseRequest(String response) {
        this.response = response;
    }

    /**
     * @return true for ACCEPT, false for DECLINE
     */
    @JsonIgnore
    public boolean isAccept() {
        return "ACCEPT".equalsIgnoreCase(response);
    }

    // Getters and setters
    public String getResponse() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
    }
}
