package com.eduhub.enrollment.infrastructure.realtime;

import com.eduhub.enrollment.infrastructure.messaging.NotificationPublisher;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.service.EnrollmentEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Realtime Broadcast Layer: fans committed enrollment events out to STOMP
 * subscribers and hands student-facing ones to the notification topic.
 *
 * Routing:
 * - class-wide types -> /topic/class/{classId}
 * - any event with a student -> /topic/student/{studentId}
 * - roster types -> /topic/teacher/{teacherId}, when the class has a teacher
 *
 * Message format:
 *   { "type": "...", "classId": "...", "studentId": "...", "data": {...}, "timestamp": "..." }
 *
 * A failed send is logged and counted; the remaining destinations still receive the event.
 *
 * @author Enrollment Team
 */
@Service
public class RealtimeBroadcastService implements EnrollmentEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeBroadcastService.class);

    public static final String CLASS_TOPIC = "/topic/class/";
    public static final String STUDENT_TOPIC = "/topic/student/";
    public static final String TEACHER_TOPIC = "/topic/teacher/";

    private final SimpMessagingTemplate messagingTemplate;
    private final NotificationPublisher notificationPublisher;
    private final CloudWatchMetricsService metricsService;

    public RealtimeBroadcastService(
            SimpMessagingTemplate messagingTemplate,
            NotificationPublisher notificationPublisher,
            CloudWatchMetricsService metricsService
    ) {
        this.messagingTemplate = messagingTemplate;
        this.notificationPublisher = notificationPublisher;
        this.metricsService = metricsService;
    }

    @Override
    public void publish(List<EnrollmentEvent> events) {
        for (EnrollmentEvent event : events) {
            broadcast(event);
            if (event.getType().notifiesStudent()) {
                notificationPublisher.notify(event);
            }
        }
    }

    /**
     * Send one event to every topic it routes to.
     */
    public void broadcast(EnrollmentEvent event) {
        Map<String, Object> envelope = toEnvelope(event);
        EnrollmentEvent.EventType type = event.getType();

        if (type.isClassWide()) {
            send("class", CLASS_TOPIC + event.getClassId(), envelope);
        }
        if (event.getStudentId() != null) {
            send("student", STUDENT_TOPIC + event.getStudentId(), envelope);
        }
        if (type.isRosterChange() && event.getTeacherId() != null) {
            send("teacher", TEACHER_TOPIC + event.getTeacherId(), envelope);
        }
    }

    private void send(String topicKind, String destination, Map<String, Object> envelope) {
        try {
            messagingTemplate.convertAndSend(destination, envelope);
            logger.debug("Broadcast {} -> {}", envelope.get("type"), destination);
        } catch (RuntimeException e) {
            logger.error("Failed to broadcast {} to {}", envelope.get("type"), destination, e);
            metricsService.recordBroadcastFailure(topicKind);
        }
    }

    static Map<String, Object> toEnvelope(EnrollmentEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", event.getType().name());
        envelope.put("classId", event.getClassId());
        if (event.getStudentId() != null) {
            envelope.put("studentId", event.getStudentId());
        }
        envelope.put("data", event.getData());
        envelope.put("timestamp", event.getTimestamp().toString());
        return envelope;
    }
}
