package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.ClassCapacity;
import com.eduhub.enrollment.domain.model.Enrollment;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.domain.model.OfferStatus;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import com.eduhub.enrollment.exception.DuplicateEnrollmentException;
import com.eduhub.enrollment.exception.EnrollmentException;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent.EventType;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.EnrollmentRepository;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EnrollmentStateMachine.
 * Admission, waitlisting and drops with mocked storage.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EnrollmentStateMachine Unit Tests")
class EnrollmentStateMachineTest {

    private static final String CLASS_ID = "CS101";

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private WaitlistEntryRepository waitlistEntryRepository;

    @Mock
    private CapacityStore capacityStore;

    @Mock
    private WaitlistService waitlistService;

    @Mock
    private EnrollmentAuditService auditService;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private EnrollmentStateMachine stateMachine;

    private Instant now;
    private OperationContext context;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2026-03-01T10:00:00Z");
        context = new OperationContext("test", CLASS_ID, now);
    }

    private WaitlistEntry entry(String studentId, int position) {
        return WaitlistEntry.builder()
                .classId(CLASS_ID)
                .studentId(studentId)
                .position(position)
                .joinedAt(now)
                .offerStatus(OfferStatus.NONE)
                .build();
    }

    private ClassCapacity classCapacity(int capacity, int enrolled, int waitlistCapacity) {
        return ClassCapacity.builder()
                .classId(CLASS_ID)
                .capacity(capacity)
                .enrolledCount(enrolled)
                .waitlistCapacity(waitlistCapacity)
                .build();
    }

    private Enrollment enrollment(String studentId, EnrollmentStatus status) {
        return Enrollment.builder()
                .enrollmentId("enr-" + studentId)
                .studentId(studentId)
                .classId(CLASS_ID)
                .status(status)
                .requestedAt(now.minusSeconds(600))
                .build();
    }

    // ========================================
    // requestEnrollment() Tests
    // ========================================

    @Test
    @DisplayName("requestEnrollment - Duplicate active enrollment is rejected")
    void requestEnrollment_Duplicate_Throws() {
        // Given
        when(enrollmentRepository.hasActiveEnrollment("s1", CLASS_ID)).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> stateMachine.requestEnrollment("s1", CLASS_ID, null, context))
                .isInstanceOf(DuplicateEnrollmentException.class)
                .hasFieldOrPropertyWithValue("reason", FailureReason.DUPLICATE_REQUEST);

        verify(capacityStore, never()).tryReserveSeat(anyString());
        verify(enrollmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("requestEnrollment - Seat free and no offer outstanding enrolls directly")
    void requestEnrollment_SeatFree_Enrolls() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(2, 0, 10));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(0L);
        when(capacityStore.tryReserveSeat(CLASS_ID)).thenReturn(true);

        // When
        EnrollmentResult result = stateMachine.requestEnrollment("s1", CLASS_ID, "Required for my major", context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.ENROLLED);
        assertThat(result.getPosition()).isNull();

        ArgumentCaptor<Enrollment> saved = ArgumentCaptor.forClass(Enrollment.class);
        verify(enrollmentRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(EnrollmentStatus.ENROLLED);
        assertThat(saved.getValue().getJustification()).isEqualTo("Required for my major");

        assertThat(context.getEvents()).extracting(EnrollmentEvent::getType)
                .containsExactly(EventType.ENROLLMENT_CONFIRMED);
        verify(auditService).record("s1", CLASS_ID, AuditAction.ENROLLED,
                EnrollmentStatus.PENDING, EnrollmentStatus.ENROLLED, null, now);
        verify(waitlistService, never()).join(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("requestEnrollment - Full class waitlists at the tail")
    void requestEnrollment_Full_Waitlists() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(1, 1, 10));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(0L);
        when(waitlistEntryRepository.countByClassId(CLASS_ID)).thenReturn(0L);
        when(waitlistService.join(CLASS_ID, "s3", context)).thenReturn(entry("s3", 1));
        when(waitlistService.promoteNext(CLASS_ID, context)).thenReturn(Optional.empty());

        // When
        EnrollmentResult result = stateMachine.requestEnrollment("s3", CLASS_ID, null, context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.WAITLISTED);
        assertThat(result.getPosition()).isEqualTo(1);
        assertThat(result.getOfferExpiresAt()).isNull();

        EnrollmentEvent joined = context.getEvents().get(0);
        assertThat(joined.getType()).isEqualTo(EventType.WAITLIST_JOINED);
        assertThat(joined.getData()).containsEntry("position", 1);
        verify(capacityStore, never()).tryReserveSeat(anyString());
        verify(metricsService).recordRequestOutcome(CLASS_ID, "WAITLISTED");
    }

    @Test
    @DisplayName("requestEnrollment - A seat held for an outstanding offer is not taken")
    void requestEnrollment_SeatHeldForOffer_Waitlists() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(2, 1, 10));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(1L);
        when(waitlistEntryRepository.countByClassId(CLASS_ID)).thenReturn(1L);
        when(waitlistService.join(CLASS_ID, "s4", context)).thenReturn(entry("s4", 2));
        when(waitlistService.promoteNext(CLASS_ID, context)).thenReturn(Optional.empty());

        // When
        EnrollmentResult result = stateMachine.requestEnrollment("s4", CLASS_ID, null, context);

        // Then
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.WAITLISTED);
        assertThat(result.getPosition()).isEqualTo(2);
        verify(capacityStore, never()).tryReserveSeat(anyString());
    }

    @Test
    @DisplayName("requestEnrollment - Seats beyond those held for offers are taken even with a queue")
    void requestEnrollment_SeatsBeyondOffers_Enrolls() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(10, 2, 10));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(1L);
        when(capacityStore.tryReserveSeat(CLASS_ID)).thenReturn(true);

        // When
        EnrollmentResult result = stateMachine.requestEnrollment("s6", CLASS_ID, null, context);

        // Then
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.ENROLLED);
        verify(waitlistService, never()).join(anyString(), anyString(), any());
        verify(waitlistEntryRepository, never()).countByClassId(anyString());
    }

    @Test
    @DisplayName("requestEnrollment - Full class with a full waitlist is denied")
    void requestEnrollment_WaitlistFull_Throws() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(1, 1, 2));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(0L);
        when(waitlistEntryRepository.countByClassId(CLASS_ID)).thenReturn(2L);

        // When / Then
        assertThatThrownBy(() -> stateMachine.requestEnrollment("s7", CLASS_ID, null, context))
                .isInstanceOf(EnrollmentException.class)
                .hasFieldOrPropertyWithValue("reason", FailureReason.WAITLIST_FULL);

        verify(waitlistService, never()).join(anyString(), anyString(), any());
        verify(enrollmentRepository, never()).save(any());
        assertThat(context.hasEvents()).isFalse();
    }

    @Test
    @DisplayName("requestEnrollment - Zero waitlist capacity denies once the class is full")
    void requestEnrollment_NoWaitlist_Throws() {
        // Given
        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(1, 1, 0));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(0L);
        when(waitlistEntryRepository.countByClassId(CLASS_ID)).thenReturn(0L);

        // When / Then
        assertThatThrownBy(() -> stateMachine.requestEnrollment("s8", CLASS_ID, null, context))
                .isInstanceOf(EnrollmentException.class)
                .hasFieldOrPropertyWithValue("reason", FailureReason.WAITLIST_FULL);
    }

    @Test
    @DisplayName("requestEnrollment - Lost reservation falls back to the queue and may get the offer at once")
    void requestEnrollment_OfferedImmediately_CarriesDeadline() {
        // Given
        WaitlistEntry joined = entry("s5", 1);
        WaitlistEntry offered = entry("s5", 1);
        offered.offer(now, Duration.ofHours(24));

        when(capacityStore.load(CLASS_ID)).thenReturn(classCapacity(1, 0, 10));
        when(waitlistEntryRepository.countByClassIdAndOfferStatus(CLASS_ID, OfferStatus.OFFERED)).thenReturn(0L);
        when(capacityStore.tryReserveSeat(CLASS_ID)).thenReturn(false);
        when(waitlistEntryRepository.countByClassId(CLASS_ID)).thenReturn(0L);
        when(waitlistService.join(CLASS_ID, "s5", context)).thenReturn(joined);
        when(waitlistService.promoteNext(CLASS_ID, context)).thenReturn(Optional.of(offered));

        // When
        EnrollmentResult result = stateMachine.requestEnrollment("s5", CLASS_ID, null, context);

        // Then
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.WAITLISTED);
        assertThat(result.getOfferExpiresAt()).isEqualTo(now.plus(Duration.ofHours(24)));
    }

    // ========================================
    // dropEnrollment() Tests
    // ========================================

    @Test
    @DisplayName("dropEnrollment - Enrolled student frees a seat and the waitlist is promoted")
    void dropEnrollment_Enrolled_ReleasesSeat() {
        // Given
        Enrollment enrolled = enrollment("s1", EnrollmentStatus.ENROLLED);
        when(enrollmentRepository.findActiveEnrollment("s1", CLASS_ID)).thenReturn(Optional.of(enrolled));
        when(capacityStore.releaseSeat(CLASS_ID)).thenReturn(1);

        // When
        EnrollmentResult result = stateMachine.dropEnrollment("s1", CLASS_ID, context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.DROPPED);
        assertThat(enrolled.getStatus()).isEqualTo(EnrollmentStatus.DROPPED);
        assertThat(enrolled.getStatusReason()).isEqualTo(Enrollment.REASON_STUDENT_DROP);

        EnrollmentEvent dropped = context.getEvents().get(0);
        assertThat(dropped.getType()).isEqualTo(EventType.ENROLLMENT_DROPPED);
        assertThat(dropped.getData()).containsEntry("enrolledCount", 1);

        verify(waitlistService).promoteNext(CLASS_ID, context);
        verify(metricsService).recordDrop(CLASS_ID, "ENROLLED");
    }

    @Test
    @DisplayName("dropEnrollment - Waitlisted student holding an offer passes it on")
    void dropEnrollment_WaitlistedWithOffer_Promotes() {
        // Given
        WaitlistEntry offered = entry("s2", 1);
        offered.offer(now.minusSeconds(60), Duration.ofHours(24));
        when(enrollmentRepository.findActiveEnrollment("s2", CLASS_ID))
                .thenReturn(Optional.of(enrollment("s2", EnrollmentStatus.WAITLISTED)));
        when(waitlistEntryRepository.findByClassIdAndStudentId(CLASS_ID, "s2")).thenReturn(Optional.of(offered));

        // When
        EnrollmentResult result = stateMachine.dropEnrollment("s2", CLASS_ID, context);

        // Then
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.DROPPED);
        verify(waitlistService).remove(offered, context);
        verify(waitlistService).promoteNext(CLASS_ID, context);
        verify(capacityStore, never()).releaseSeat(anyString());
    }

    @Test
    @DisplayName("dropEnrollment - Waitlisted student without an offer just leaves the queue")
    void dropEnrollment_WaitlistedNoOffer_NoPromotion() {
        // Given
        WaitlistEntry waiting = entry("s3", 2);
        when(enrollmentRepository.findActiveEnrollment("s3", CLASS_ID))
                .thenReturn(Optional.of(enrollment("s3", EnrollmentStatus.WAITLISTED)));
        when(waitlistEntryRepository.findByClassIdAndStudentId(CLASS_ID, "s3")).thenReturn(Optional.of(waiting));

        // When
        stateMachine.dropEnrollment("s3", CLASS_ID, context);

        // Then
        verify(waitlistService).remove(waiting, context);
        verify(waitlistService, never()).promoteNext(anyString(), any());
    }

    @Test
    @DisplayName("dropEnrollment - Nothing to drop is a successful no-op")
    void dropEnrollment_NoActive_NoChange() {
        // Given
        when(enrollmentRepository.findActiveEnrollment("s9", CLASS_ID)).thenReturn(Optional.empty());

        // When
        EnrollmentResult result = stateMachine.dropEnrollment("s9", CLASS_ID, context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.DROPPED);
        assertThat(context.hasEvents()).isFalse();
        verify(enrollmentRepository, never()).save(any());
        verify(metricsService, never()).recordDrop(anyString(), anyString());
    }
}
