package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.WaitlistEntry;
import java.time.Instant;

/**
 * Response DTO for one waitlist entry.
 *
 * @author Enrollment Team
 */
public class WaitlistEntryResponse {

    private String studentId;
    private int position;
    private Instant joinedAt;
    private String offerStatus;
    private Instant offerExpiresAt;

    public WaitlistEntryResponse() {
    }

    public static WaitlistEntryResponse fromEntity(WaitlistEntry entry) {
        WaitlistEntryResponse response = new WaitlistEntryResponse();
        response.setStudentId(entry.getStudentId());
        response.setPosition(entry.getPosition());
        response.setJoinedAt(entry.getJoinedAt());
        response.setOfferStatus(entry.getOfferStatus().name());
        response.setOfferExpiresAt(entry.getOfferExpiresAt());
        return response;
    }

    // Getters and setters
    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    public String getOfferStatus() {
        return offerStatus;
    }

    public void setOfferStatus(String offerStatus) {
        this.offerStatus = offerStatus;
    }

    public Instant getOfferExpiresAt() {
        return offerExpiresAt;
    }

    public void setOfferExpiresAt(Instant offerExpiresAt) {
        this.offerExpiresAt = offerExpiresAt;
    }
}
