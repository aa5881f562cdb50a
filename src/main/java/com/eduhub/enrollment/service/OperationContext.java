package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.ClassCapacity;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * State of one coordinator operation on one class: the reference time and
 * the events collected while the class lock is held. Events are published
 * only after the transaction commits, and discarded on rollback.
 *
 * @author Enrollment Team
 */
public class OperationContext {

    private final String operation;
    private final String classId;
    private final Instant now;
    private final List<EnrollmentEvent> events = new ArrayList<>();
    private String teacherId;

    public OperationContext(String operation, String classId, Instant now) {
        this.operation = operation;
        this.classId = classId;
        this.now = now;
    }

    public OperationContext(String operation, ClassCapacity classCapacity, Instant now) {
        this(operation, classCapacity.getClassId(), now);
        this.teacherId = classCapacity.getTeacherId();
    }

    public void bindClass(ClassCapacity classCapacity) {
        this.teacherId = classCapacity.getTeacherId();
    }

    public void emitToStudent(EnrollmentEvent.EventType type, String studentId, Map<String, Object> data) {
        events.add(EnrollmentEvent.forStudent(type, classId, studentId, teacherId, data));
    }

    public void emitToClass(EnrollmentEvent.EventType type, Map<String, Object> data) {
        events.add(EnrollmentEvent.forClass(type, classId, teacherId, data));
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    public List<EnrollmentEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void discardEvents() {
        events.clear();
    }

    public String getOperation() {
        return operation;
    }

    public String getClassId() {
        return classId;
    }

    public String getTeacherId() {
        return teacherId;
    }

    public Instant getNow() {
        return now;
    }
}
