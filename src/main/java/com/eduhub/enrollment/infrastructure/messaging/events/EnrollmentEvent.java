package com.eduhub.enrollment.infrastructure.messaging.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State-change event emitted by the enrollment core.
 * Fanned out to realtime subscribers and, for student-facing types, to the
 * notification topic.
 *
 * Routing:
 * - class-wide types go to class:{classId}
 * - any event with a studentId goes to student:{studentId}
 * - roster types go to teacher:{teacherId} when the class has a teacher
 *
 * @author Enrollment Team
 */
public class EnrollmentEvent {

    private EventType type;
    private String classId;
    private String studentId;
    private String teacherId;
    private Map<String, Object> data;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public EnrollmentEvent() {
    }

    public EnrollmentEvent(
            EventType type,
            String classId,
            String studentId,
            String teacherId,
            Map<String, Object> data
    ) {
        this.type = type;
        this.classId = classId;
        this.studentId = studentId;
        this.teacherId = teacherId;
        this.data = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        this.timestamp = Instant.now();
    }

    public static EnrollmentEvent forStudent(EventType type, String classId, String studentId,
                                             String teacherId, Map<String, Object> data) {
        return new EnrollmentEvent(type, classId, studentId, teacherId, data);
    }

    public static EnrollmentEvent forClass(EventType type, String classId, String teacherId,
                                           Map<String, Object> data) {
        return new EnrollmentEvent(type, classId, null, teacherId, data);
    }

    public EventType getType() {
        return type;
    }

    public void setType(EventType type) {
        this.type = type;
    }

    public String getClassId() {
        return classId;
    }

    public void setClassId(String classId) {
        this.classId = classId;
    }

    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public String getTeacherId() {
        return teacherId;
    }

    public void setTeacherId(String teacherId) {
        this.teacherId = teacherId;
    }

    public Map<String, Object> getData() {
        return data == null ? Collections.emptyMap() : data;
    }

    public void setData(Map<String, Object> data) {
        this.data = data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Event types and where they are routed.
     */
    public enum EventType {
        ENROLLMENT_CONFIRMED(true, true, true),
        WAITLIST_JOINED(true, false, true),
        WAITLIST_ADVANCEMENT(false, false, true),
        WAITLIST_POSITION_CHANGE(false, false, true),
        WAITLIST_REMOVED(false, false, false),
        ENROLLMENT_DROPPED(true, true, false),
        OFFER_EXPIRED(false, false, true),
        ENROLLMENT_COUNT_UPDATE(true, true, false),
        CAPACITY_CHANGE(true, true, false),
        DEADLINE_REMINDER(false, false, true);

        private final boolean classWide;
        private final boolean rosterChange;
        private final boolean notifiesStudent;

        EventType(boolean classWide, boolean rosterChange, boolean notifiesStudent) {
            this.classWide = classWide;
            this.rosterChange = rosterChange;
            this.notifiesStudent = notifiesStudent;
        }

        /**
         * @return true if broadcast on class:{classId}
         */
        public boolean isClassWide() {
            return classWide;
        }

        /**
         * @return true if broadcast on teacher:{teacherId}
         */
        public boolean isRosterChange() {
            return rosterChange;
        }

        /**
         * @return true if handed to the notification collaborator
         */
        public boolean notifiesStudent() {
            return notifiesStudent;
        }
    }

    @Override
    public String toString() {
        return "EnrollmentEvent{" +
                "type=" + type +
                ", classId='" + classId + '\'' +
                ", studentId='" + studentId + '\'' +
                ", data=" + data +
                ", timestamp=" + timestamp +
                '}';
    }
}
