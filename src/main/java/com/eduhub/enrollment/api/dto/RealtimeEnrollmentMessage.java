package com.eduhub.enrollment.api.dto;

/**
 * Inbound STOMP payload for enrollment.request, enrollment.drop and waitlist.respond.
 * response is only read by waitlist.respond (ACCEPT or DECLINE).
 *
 * @author Enrollment Team
 */
public class RealtimeEnrollmentMessage {

    private String studentId;
    private String classId;
    private String justification;
    private String response;

    public RealtimeEnrollmentMessage() {
    }

    public RealtimeEnrollmentMessage(String studentId, String classId, String justification, String response) {
        this.studentId = studentId;
        this.classId = classId;
        this.justification = justification;
        this.response = response;
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

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }

    public String getResponse() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
    }
}
