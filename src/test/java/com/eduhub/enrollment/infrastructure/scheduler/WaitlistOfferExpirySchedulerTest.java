package com.eduhub.enrollment.infrastructure.scheduler;

import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WaitlistOfferExpiryScheduler.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("WaitlistOfferExpiryScheduler Unit Tests")
class WaitlistOfferExpirySchedulerTest {

    @Mock
    private WaitlistEntryRepository waitlistEntryRepository;

    @Mock
    private EnrollmentCoordinator coordinator;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private WaitlistOfferExpiryScheduler scheduler;

    private WaitlistEntry entry(String classId, String studentId) {
        return WaitlistEntry.builder().classId(classId).studentId(studentId).position(1).build();
    }

    @Test
    @DisplayName("triggerSweepNow - Expires each due offer and keeps going after a failure")
    void triggerSweepNow_ExpiresDueOffers() {
        // Given
        when(waitlistEntryRepository.findExpiredOffers(any(Instant.class)))
                .thenReturn(List.of(entry("CS101", "s1"), entry("CS102", "s2"), entry("CS103", "s3")));
        when(waitlistEntryRepository.findOffersDueForReminder(any(Instant.class), any(Instant.class)))
                .thenReturn(Collections.emptyList());
        when(coordinator.expireOffer("CS101", "s1")).thenReturn(EnrollmentResult.dropped("Offer expired"));
        when(coordinator.expireOffer("CS102", "s2")).thenThrow(new IllegalStateException("unexpected"));
        when(coordinator.expireOffer("CS103", "s3"))
                .thenReturn(EnrollmentResult.noChange(null, "No expired offer"));

        // When
        int expired = scheduler.triggerSweepNow();

        // Then
        assertThat(expired).isEqualTo(1);
        verify(coordinator, times(3)).expireOffer(anyString(), anyString());
        verify(metricsService).recordError("OFFER_EXPIRY_PROCESSING_ERROR", "expireDueOffers");
    }

    @Test
    @DisplayName("sweepOffers - Sends reminders for offers close to their deadline")
    void sweepOffers_SendsReminders() {
        // Given
        when(waitlistEntryRepository.findExpiredOffers(any(Instant.class))).thenReturn(Collections.emptyList());
        when(waitlistEntryRepository.findOffersDueForReminder(any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(entry("CS101", "s4")));
        when(coordinator.remindOffer("CS101", "s4"))
                .thenReturn(EnrollmentResult.noChange(EnrollmentStatus.WAITLISTED, "Reminder sent"));

        // When
        scheduler.sweepOffers();

        // Then
        verify(coordinator).remindOffer("CS101", "s4");
        verify(coordinator, never()).expireOffer(anyString(), anyString());
    }

    @Test
    @DisplayName("remindPendingOffers - Counts only reminders that were sent")
    void remindPendingOffers_CountsSentOnly() {
        // Given
        when(waitlistEntryRepository.findOffersDueForReminder(any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(entry("CS101", "s4"), entry("CS101", "s5"), entry("CS102", "s6")));
        when(coordinator.remindOffer("CS101", "s4"))
                .thenReturn(EnrollmentResult.noChange(EnrollmentStatus.WAITLISTED, "Reminder sent"));
        when(coordinator.remindOffer("CS101", "s5"))
                .thenReturn(EnrollmentResult.noChange(null, "No reminder due"));
        when(coordinator.remindOffer("CS102", "s6"))
                .thenReturn(EnrollmentResult.failure(FailureReason.STORAGE_FAILURE, "db down"));

        // When
        int reminded = scheduler.remindPendingOffers(Instant.parse("2026-03-01T10:00:00Z"));

        // Then
        assertThat(reminded).isEqualTo(1);
        verify(coordinator, times(3)).remindOffer(anyString(), anyString());
    }

    @Test
    @DisplayName("sweepOffers - A failed expiry result is logged without an error metric")
    void sweepOffers_FailedResult_NotCounted() {
        // Given
        when(waitlistEntryRepository.findExpiredOffers(any(Instant.class)))
                .thenReturn(List.of(entry("CS101", "s1")));
        when(waitlistEntryRepository.findOffersDueForReminder(any(Instant.class), any(Instant.class)))
                .thenReturn(Collections.emptyList());
        when(coordinator.expireOffer("CS101", "s1"))
                .thenReturn(EnrollmentResult.failure(FailureReason.STORAGE_FAILURE, "db down"));

        // When
        scheduler.sweepOffers();

        // Then
        verify(metricsService, never()).recordError(anyString(), anyString());
    }

    @Test
    @DisplayName("sweepOffers - Disabled scheduler does nothing")
    void sweepOffers_Disabled_NoOp() {
        // Given
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", false);

        // When
        scheduler.sweepOffers();

        // Then
        verifyNoInteractions(waitlistEntryRepository, coordinator);
    }
}
