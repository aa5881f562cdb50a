package com.eduhub.enrollment.infrastructure.realtime;

import com.eduhub.enrollment.infrastructure.messaging.NotificationPublisher;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent.EventType;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RealtimeBroadcastService topic routing.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeBroadcastService Unit Tests")
class RealtimeBroadcastServiceTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @Mock
    private NotificationPublisher notificationPublisher;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private RealtimeBroadcastService broadcastService;

    @Test
    @DisplayName("publish - Confirmation goes to class, student and teacher topics and is notified")
    void publish_Confirmation_AllTopics() {
        // Given
        EnrollmentEvent event = EnrollmentEvent.forStudent(
                EventType.ENROLLMENT_CONFIRMED, "CS101", "s1", "t1", Map.of());

        // When
        broadcastService.publish(List.of(event));

        // Then
        verify(messagingTemplate).convertAndSend(eq("/topic/class/CS101"), any(Object.class));
        verify(messagingTemplate).convertAndSend(eq("/topic/student/s1"), any(Object.class));
        verify(messagingTemplate).convertAndSend(eq("/topic/teacher/t1"), any(Object.class));
        verify(notificationPublisher).notify(event);
    }

    @Test
    @DisplayName("publish - Position change is private to the student")
    void publish_PositionChange_StudentOnly() {
        // Given
        EnrollmentEvent event = EnrollmentEvent.forStudent(
                EventType.WAITLIST_POSITION_CHANGE, "CS101", "s2", "t1", Map.of("position", 1));

        // When
        broadcastService.publish(List.of(event));

        // Then
        verify(messagingTemplate).convertAndSend(eq("/topic/student/s2"), any(Object.class));
        verifyNoMoreInteractions(messagingTemplate);
        verify(notificationPublisher).notify(event);
    }

    @Test
    @DisplayName("publish - Count update without a teacher reaches only the class topic")
    void publish_CountUpdate_ClassOnly() {
        // Given
        EnrollmentEvent event = EnrollmentEvent.forClass(
                EventType.ENROLLMENT_COUNT_UPDATE, "CS101", null, Map.of("enrolledCount", 2));

        // When
        broadcastService.publish(List.of(event));

        // Then
        verify(messagingTemplate).convertAndSend(eq("/topic/class/CS101"), any(Object.class));
        verifyNoMoreInteractions(messagingTemplate);
        verifyNoInteractions(notificationPublisher);
    }

    @Test
    @DisplayName("broadcast - A failed topic does not stop delivery to the others")
    void broadcast_SendFailure_ContinuesWithOtherTopics() {
        // Given
        EnrollmentEvent event = EnrollmentEvent.forStudent(
                EventType.ENROLLMENT_DROPPED, "CS101", "s1", null, Map.of("enrolledCount", 0));
        doThrow(new MessageDeliveryException("closed"))
                .when(messagingTemplate).convertAndSend(eq("/topic/class/CS101"), any(Object.class));

        // When
        broadcastService.broadcast(event);

        // Then
        verify(messagingTemplate).convertAndSend(eq("/topic/student/s1"), any(Object.class));
        verify(metricsService).recordBroadcastFailure("class");
    }

    @Test
    @DisplayName("toEnvelope - Carries type, ids, data and timestamp")
    void toEnvelope_Format() {
        // Given
        EnrollmentEvent event = EnrollmentEvent.forStudent(
                EventType.WAITLIST_JOINED, "CS101", "s3", null, Map.of("position", 1));

        // When
        Map<String, Object> envelope = RealtimeBroadcastService.toEnvelope(event);

        // Then
        assertThat(envelope).containsKeys("type", "classId", "studentId", "data", "timestamp");
        assertThat(envelope.get("type")).isEqualTo("WAITLIST_JOINED");
        assertThat(envelope.get("studentId")).isEqualTo("s3");
        assertThat(envelope.get("timestamp")).isEqualTo(event.getTimestamp().toString());
    }

    @Test
    @DisplayName("toEnvelope - Class events omit the student")
    void toEnvelope_ClassEvent_NoStudent() {
        EnrollmentEvent event = EnrollmentEvent.forClass(EventType.CAPACITY_CHANGE, "CS101", null, Map.of());

        assertThat(RealtimeBroadcastService.toEnvelope(event)).doesNotContainKey("studentId");
    }
}
