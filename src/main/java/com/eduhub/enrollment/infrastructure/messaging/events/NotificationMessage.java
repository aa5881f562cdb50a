package com.eduhub.enrollment.infrastructure.messaging.events;

import java.time.Instant;
import java.util.Map;

/**
 * Delivery request handed to the notification service over Kafka.
 * Keyed by studentId so one student's notifications stay ordered.
 *
 * @author Enrollment Team
 */
public class NotificationMessage {

    private String notificationId;
    private String studentId;
    private String classId;
    private String eventType;
    private Map<String, Object> payload;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public NotificationMessage() {
    }

    public NotificationMessage(
            String notificationId,
            String studentId,
            String classId,
            String eventType,
            Map<String, Object> payload
    ) {
        this.notificationId = notificationId;
        this.studentId = studentId;
        this.classId = classId;
        this.eventType = eventType;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    // Getters and setters
    public String getNotificationId() {
        return notificationId;
    }

    public void setNotificationId(String notificationId) {
        this.notificationId = notificationId;
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

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "NotificationMessage{" +
                "notificationId='" + notificationId + '\'' +
                ", studentId='" + studentId + '\'' +
                ", classId='" + classId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
