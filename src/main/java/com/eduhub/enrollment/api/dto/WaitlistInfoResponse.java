package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.WaitlistStudentInfo;
import java.time.Instant;

/**
 * Response DTO for a student's waitlist position.
 *
 * @author Enrollment Team
 */
public class WaitlistInfoResponse {

    private String studentId;
    private String classId;
    private boolean onWaitlist;
    private int position;
    private boolean offerOutstanding;
    private Instant responseDeadline;
    private String estimatedWaitTime;

    public WaitlistInfoResponse() {
    }

    public static WaitlistInfoResponse fromInfo(WaitlistStudentInfo info) {
        WaitlistInfoResponse response = new WaitlistInfoResponse();
        response.setStudentId(info.getStudentId());
        response.setClassId(info.getClassId());
        response.setOnWaitlist(info.isOnWaitlist());
        response.setPosition(info.getPosition());
        response.setOfferOutstanding(info.isOfferOutstanding());
        response.setResponseDeadline(info.getResponseDeadline());
        response.setEstimatedWaitTime(info.getEstimatedWaitTime());
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

    public boolean isOnWaitlist() {
        return onWaitlist;
    }

    public void setOnWaitlist(boolean onWaitlist) {
        this.onWaitlist = onWaitlist;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public boolean isOfferOutstanding() {
        return offerOutstanding;
    }

    public void setOfferOutstanding(boolean offerOutstanding) {
        this.offerOutstanding = offerOutstanding;
    }

    public Instant getResponseDeadline() {
        return responseDeadline;
    }

    public void setResponseDeadline(Instant responseDeadline) {
        this.responseDeadline = responseDeadline;
    }

    public String getEstimatedWaitTime() {
        return estimatedWaitTime;
    }

    public void setEstimatedWaitTime(String estimatedWaitTime) {
        this.estimatedWaitTime = estimatedWaitTime;
    }
}
