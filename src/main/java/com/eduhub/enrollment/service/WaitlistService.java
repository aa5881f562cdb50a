package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.ClassCapacity;
import com.eduhub.enrollment.domain.model.Enrollment;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.domain.model.OfferStatus;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import com.eduhub.enrollment.exception.WaitlistOfferException;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent.EventType;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.EnrollmentRepository;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Waitlist Ordering Engine.
 *
 * Keeps each class's queue strictly FIFO with contiguous positions from 1,
 * and runs the offer cycle:
 * 1. promoteNext offers a free seat to the lowest position without an offer
 * 2. the student accepts, declines, or lets the offer expire
 * 3. decline and expiry remove the entry and cascade to the next student
 *
 * At most one offer is outstanding per class. The seat stays notionally
 * free until the offer resolves, so no second offer fires for it.
 *
 * Every method expects the caller to hold the class lock and a transaction.
 *
 * @author Enrollment Team
 */
@Service
public class WaitlistService {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistService.class);

    private final WaitlistEntryRepository waitlistEntryRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final CapacityStore capacityStore;
    private final EnrollmentAuditService auditService;
    private final CloudWatchMetricsService metricsService;
    private final Duration offerWindow;

    public WaitlistService(
            WaitlistEntryRepository waitlistEntryRepository,
            EnrollmentRepository enrollmentRepository,
            CapacityStore capacityStore,
            EnrollmentAuditService auditService,
            CloudWatchMetricsService metricsService,
            @Value("${enrollment.waitlist.offer-window:PT24H}") Duration offerWindow
    ) {
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.capacityStore = capacityStore;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.offerWindow = offerWindow;
    }

    /**
     * Append a student at the tail of the class waitlist.
     *
     * @return the new entry, position = current max + 1
     */
    public WaitlistEntry join(String classId, String studentId, OperationContext context) {
        int position = waitlistEntryRepository.findMaxPosition(classId) + 1;

        WaitlistEntry entry = waitlistEntryRepository.save(WaitlistEntry.builder()
                .classId(classId)
                .studentId(studentId)
                .position(position)
                .joinedAt(context.getNow())
                .offerStatus(OfferStatus.NONE)
                .build());

        logger.info("Student {} joined waitlist for class {} at position {}", studentId, classId, position);
        return entry;
    }

    /**
     * Offer a free seat to the next student in line.
     * No-op while another offer is outstanding, when no seat is free, or
     * when nobody is waiting without an offer.
     *
     * @return the entry that received the offer
     */
    public Optional<WaitlistEntry> promoteNext(String classId, OperationContext context) {
        if (waitlistEntryRepository.existsByClassIdAndOfferStatus(classId, OfferStatus.OFFERED)) {
            logger.debug("Promotion for class {} skipped: an offer is outstanding", classId);
            return Optional.empty();
        }

        ClassCapacity classCapacity = capacityStore.load(classId);
        if (!classCapacity.hasOpenSeat()) {
            logger.debug("Promotion for class {} skipped: no open seat", classId);
            return Optional.empty();
        }

        Optional<WaitlistEntry> candidate = waitlistEntryRepository
                .findFirstByClassIdAndOfferStatusOrderByPositionAsc(classId, OfferStatus.NONE);
        if (candidate.isEmpty()) {
            logger.debug("Promotion for class {} skipped: waitlist empty, seat stays open", classId);
            return Optional.empty();
        }

        WaitlistEntry entry = candidate.get();
        entry.offer(context.getNow(), offerWindow);
        entry = waitlistEntryRepository.save(entry);

        auditService.record(entry.getStudentId(), classId, AuditAction.OFFERED,
                EnrollmentStatus.WAITLISTED, EnrollmentStatus.WAITLISTED,
                "Offer expires at " + entry.getOfferExpiresAt(), context.getNow());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("position", entry.getPosition());
        data.put("offerExpiresAt", entry.getOfferExpiresAt().toString());
        context.emitToStudent(EventType.WAITLIST_ADVANCEMENT, entry.getStudentId(), data);

        metricsService.recordOffer(classId, "issued");
        logger.info("Offered seat in class {} to student {} (position {}, expires {})",
                classId, entry.getStudentId(), entry.getPosition(), entry.getOfferExpiresAt());
        return Optional.of(entry);
    }

    /**
     * Apply a student's answer to their outstanding offer.
     *
     * An accept after the deadline is handled as an expiry and reported as
     * OFFER_EXPIRED. An accept that finds no free seat returns the student to
     * the queue at the same position and reports NO_SEAT_AVAILABLE.
     *
     * @throws WaitlistOfferException NO_OUTSTANDING_OFFER when the student holds no offer
     */
    public EnrollmentResult resolveOffer(String classId, String studentId, boolean accept, OperationContext context) {
        WaitlistEntry entry = waitlistEntryRepository.findByClassIdAndStudentId(classId, studentId)
                .filter(WaitlistEntry::hasOutstandingOffer)
                .orElseThrow(() -> new WaitlistOfferException(FailureReason.NO_OUTSTANDING_OFFER, studentId, classId,
                        "Student " + studentId + " has no outstanding offer for class " + classId));

        if (entry.isOfferExpired(context.getNow())) {
            expire(entry, context);
            return EnrollmentResult.failure(FailureReason.OFFER_EXPIRED,
                    "Offer expired at " + entry.getOfferExpiresAt());
        }

        return accept ? accept(entry, context) : decline(entry, context);
    }

    /**
     * Expire a student's offer if it is still outstanding and past its deadline.
     * Safe to call for offers that were already resolved.
     *
     * @return true if an offer was expired
     */
    public boolean expireIfDue(String classId, String studentId, OperationContext context) {
        Optional<WaitlistEntry> entry = waitlistEntryRepository.findByClassIdAndStudentId(classId, studentId)
                .filter(candidate -> candidate.isOfferExpired(context.getNow()));
        if (entry.isEmpty()) {
            logger.debug("No expired offer for student {} in class {}", studentId, classId);
            return false;
        }
        expire(entry.get(), context);
        return true;
    }

    /**
     * Send the deadline reminder for an outstanding offer, once.
     *
     * @return true if a reminder was emitted
     */
    public boolean remindIfDue(String classId, String studentId, OperationContext context) {
        Optional<WaitlistEntry> due = waitlistEntryRepository.findByClassIdAndStudentId(classId, studentId)
                .filter(WaitlistEntry::hasOutstandingOffer)
                .filter(candidate -> candidate.getReminderSentAt() == null)
                .filter(candidate -> !candidate.isOfferExpired(context.getNow()));
        if (due.isEmpty()) {
            return false;
        }

        WaitlistEntry entry = due.get();
        entry.setReminderSentAt(context.getNow());
        waitlistEntryRepository.save(entry);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("position", entry.getPosition());
        data.put("offerExpiresAt", entry.getOfferExpiresAt().toString());
        data.put("minutesRemaining", Duration.between(context.getNow(), entry.getOfferExpiresAt()).toMinutes());
        context.emitToStudent(EventType.DEADLINE_REMINDER, studentId, data);

        logger.info("Sent offer deadline reminder to student {} for class {}", studentId, classId);
        return true;
    }

    /**
     * Remove an entry and close the gap behind it.
     * Every shifted student receives a position change event.
     */
    public void remove(WaitlistEntry entry, OperationContext context) {
        String classId = entry.getClassId();
        int removedPosition = entry.getPosition();
        List<WaitlistEntry> behind = waitlistEntryRepository.findEntriesAfter(classId, removedPosition);

        waitlistEntryRepository.delete(entry);
        int shifted = waitlistEntryRepository.shiftPositionsDown(classId, removedPosition);

        Map<String, Object> removedData = new LinkedHashMap<>();
        removedData.put("position", removedPosition);
        context.emitToStudent(EventType.WAITLIST_REMOVED, entry.getStudentId(), removedData);

        for (WaitlistEntry moved : behind) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("previousPosition", moved.getPosition());
            data.put("position", moved.getPosition() - 1);
            context.emitToStudent(EventType.WAITLIST_POSITION_CHANGE, moved.getStudentId(), data);
        }

        logger.info("Removed student {} from position {} of class {} waitlist, {} entries renumbered",
                entry.getStudentId(), removedPosition, classId, shifted);
    }

    private EnrollmentResult accept(WaitlistEntry entry, OperationContext context) {
        String classId = entry.getClassId();
        String studentId = entry.getStudentId();

        if (!capacityStore.tryReserveSeat(classId)) {
            entry.withdrawOffer();
            waitlistEntryRepository.save(entry);
            logger.warn("Student {} accepted offer for class {} but no seat is left; back in queue at position {}",
                    studentId, classId, entry.getPosition());
            return EnrollmentResult.failure(FailureReason.NO_SEAT_AVAILABLE,
                    "No seat available; you remain on the waitlist at position " + entry.getPosition());
        }

        remove(entry, context);

        Enrollment enrollment = activeWaitlistedEnrollment(studentId, classId);
        enrollment.enroll(context.getNow());
        enrollmentRepository.save(enrollment);

        auditService.record(studentId, classId, AuditAction.OFFER_ACCEPTED,
                EnrollmentStatus.WAITLISTED, EnrollmentStatus.ENROLLED, null, context.getNow());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("fromWaitlist", true);
        context.emitToStudent(EventType.ENROLLMENT_CONFIRMED, studentId, data);

        metricsService.recordOffer(classId, "accepted");
        logger.info("Student {} accepted offer and enrolled in class {}", studentId, classId);

        promoteNext(classId, context);
        return EnrollmentResult.enrolled("Offer accepted; enrolled in " + classId);
    }

    private EnrollmentResult decline(WaitlistEntry entry, OperationContext context) {
        String classId = entry.getClassId();
        String studentId = entry.getStudentId();

        remove(entry, context);
        dropWaitlistedEnrollment(studentId, classId, Enrollment.REASON_OFFER_DECLINED, context);

        auditService.record(studentId, classId, AuditAction.OFFER_DECLINED,
                EnrollmentStatus.WAITLISTED, EnrollmentStatus.DROPPED, Enrollment.REASON_OFFER_DECLINED,
                context.getNow());

        metricsService.recordOffer(classId, "declined");
        logger.info("Student {} declined offer for class {}", studentId, classId);

        promoteNext(classId, context);
        return EnrollmentResult.dropped("Offer declined; removed from the waitlist");
    }

    private void expire(WaitlistEntry entry, OperationContext context) {
        String classId = entry.getClassId();
        String studentId = entry.getStudentId();
        Instant expiredAt = entry.getOfferExpiresAt();

        remove(entry, context);
        dropWaitlistedEnrollment(studentId, classId, Enrollment.REASON_OFFER_EXPIRED, context);

        auditService.record(studentId, classId, AuditAction.OFFER_EXPIRED,
                EnrollmentStatus.WAITLISTED, EnrollmentStatus.DROPPED, Enrollment.REASON_OFFER_EXPIRED,
                context.getNow());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("offerExpiresAt", expiredAt.toString());
        context.emitToStudent(EventType.OFFER_EXPIRED, studentId, data);

        metricsService.recordOffer(classId, "expired");
        logger.info("Offer to student {} for class {} expired at {}", studentId, classId, expiredAt);

        promoteNext(classId, context);
    }

    private void dropWaitlistedEnrollment(String studentId, String classId, String reason, OperationContext context) {
        Enrollment enrollment = activeWaitlistedEnrollment(studentId, classId);
        enrollment.drop(reason, context.getNow());
        enrollmentRepository.save(enrollment);
    }

    private Enrollment activeWaitlistedEnrollment(String studentId, String classId) {
        return enrollmentRepository.findActiveEnrollment(studentId, classId)
                .filter(enrollment -> enrollment.getStatus() == EnrollmentStatus.WAITLISTED)
                .orElseThrow(() -> new IllegalStateException(
                        "Waitlist entry without a waitlisted enrollment: " + studentId + "/" + classId));
    }
}
