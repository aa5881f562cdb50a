package com.eduhub.enrollment.infrastructure.messaging;

import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;
import com.eduhub.enrollment.infrastructure.messaging.events.NotificationMessage;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for the notification collaborator.
 *
 * Fire-and-forget: failures are logged and counted but never propagate,
 * so a broker outage cannot roll back an enrollment decision. Sends run on
 * the notification executor, so the caller never waits on the producer.
 *
 * Partitioning:
 * - Key: studentId (one student's notifications arrive in order)
 *
 * @author Enrollment Team
 */
@Service
public class NotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CloudWatchMetricsService metricsService;
    private final TaskExecutor notificationExecutor;

    @Value("${enrollment.notifications.topic:enrollment-notifications}")
    private String notificationTopic = "enrollment-notifications";

    public NotificationPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            CloudWatchMetricsService metricsService,
            @Qualifier("notificationExecutor") TaskExecutor notificationExecutor
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.notificationExecutor = notificationExecutor;
    }

    /**
     * Publish a notification for a student-facing event.
     *
     * @param event Enrollment event carrying a studentId
     */
    public void notify(EnrollmentEvent event) {
        if (event.getStudentId() == null) {
            logger.debug("Skipping notification without student: {}", event.getType());
            return;
        }
        notify(event.getStudentId(), event.getClassId(), event.getType().name(), event.getData());
    }

    /**
     * Queue a delivery request on the notification executor.
     * A full queue drops the notification and counts it as failed.
     *
     * @param studentId Recipient
     * @param classId Class the notification is about
     * @param eventType Event type name
     * @param payload Event data
     */
    public void notify(String studentId, String classId, String eventType, Map<String, Object> payload) {
        NotificationMessage message = new NotificationMessage(
                UUID.randomUUID().toString(),
                studentId,
                classId,
                eventType,
                payload
        );

        try {
            notificationExecutor.execute(() -> send(message));
        } catch (TaskRejectedException e) {
            logger.error("Notification queue full, dropping {} notification for student {}",
                    eventType, studentId, e);
            metricsService.recordNotificationFailure(eventType);
        }
    }

    private void send(NotificationMessage message) {
        String studentId = message.getStudentId();
        String classId = message.getClassId();
        String eventType = message.getEventType();

        try {
            String body = objectMapper.writeValueAsString(message);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    notificationTopic,
                    studentId,
                    body
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} notification for student {}, class {}, partition: {}",
                            eventType, studentId, classId, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to deliver {} notification for student {}, class {}",
                            eventType, studentId, classId, ex);
                    metricsService.recordNotificationFailure(eventType);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} notification for student {}", eventType, studentId, e);
            metricsService.recordNotificationFailure(eventType);
        } catch (RuntimeException e) {
            // send() can fail synchronously, e.g. when broker metadata is unavailable
            logger.error("Error sending {} notification for student {}", eventType, studentId, e);
            metricsService.recordNotificationFailure(eventType);
        }
    }
}
