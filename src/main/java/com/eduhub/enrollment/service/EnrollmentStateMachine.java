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
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent.EventType;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.EnrollmentRepository;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Enrollment State Machine: one student's relationship to one class.
 *
 * PENDING -> ENROLLED | WAITLISTED | DENIED
 * ENROLLED -> DROPPED
 * WAITLISTED -> ENROLLED (offer accepted) | DROPPED
 *
 * Every method expects the caller to hold the class lock and a transaction.
 *
 * @author Enrollment Team
 */
@Service
public class EnrollmentStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentStateMachine.class);

    private final EnrollmentRepository enrollmentRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final CapacityStore capacityStore;
    private final WaitlistService waitlistService;
    private final EnrollmentAuditService auditService;
    private final CloudWatchMetricsService metricsService;

    public EnrollmentStateMachine(
            EnrollmentRepository enrollmentRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            CapacityStore capacityStore,
            WaitlistService waitlistService,
            EnrollmentAuditService auditService,
            CloudWatchMetricsService metricsService
    ) {
        this.enrollmentRepository = enrollmentRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.capacityStore = capacityStore;
        this.waitlistService = waitlistService;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    /**
     * Admit a student or queue them.
     *
     * A seat is taken directly when free seats outnumber those held for
     * outstanding offers. Otherwise the student joins the tail, provided the
     * waitlist has room.
     *
     * @throws DuplicateEnrollmentException if the pair already has an active enrollment
     * @throws EnrollmentException WAITLIST_FULL when neither a seat nor a queue slot is free
     */
    public EnrollmentResult requestEnrollment(String studentId, String classId, String justification,
                                              OperationContext context) {
        if (enrollmentRepository.hasActiveEnrollment(studentId, classId)) {
            throw new DuplicateEnrollmentException(studentId, classId);
        }

        Enrollment enrollment = Enrollment.builder()
                .studentId(studentId)
                .classId(classId)
                .status(EnrollmentStatus.PENDING)
                .justification(justification)
                .requestedAt(context.getNow())
                .build();

        ClassCapacity classCapacity = capacityStore.load(classId);
        long heldForOffers = waitlistEntryRepository.countByClassIdAndOfferStatus(classId, OfferStatus.OFFERED);
        if (classCapacity.getAvailableSeats() > heldForOffers && capacityStore.tryReserveSeat(classId)) {
            enrollment.enroll(context.getNow());
            enrollmentRepository.save(enrollment);

            auditService.record(studentId, classId, AuditAction.ENROLLED,
                    EnrollmentStatus.PENDING, EnrollmentStatus.ENROLLED, null, context.getNow());
            context.emitToStudent(EventType.ENROLLMENT_CONFIRMED, studentId, new LinkedHashMap<>());

            metricsService.recordRequestOutcome(classId, EnrollmentStatus.ENROLLED.name());
            logger.info("Student {} enrolled in class {}", studentId, classId);
            return EnrollmentResult.enrolled("Enrolled in " + classId);
        }

        long queued = waitlistEntryRepository.countByClassId(classId);
        if (!classCapacity.hasWaitlistRoom(queued)) {
            throw new EnrollmentException(FailureReason.WAITLIST_FULL, String.format(
                    "Class %s is full and its waitlist holds %d of %d", classId, queued,
                    classCapacity.getWaitlistCapacity()));
        }

        WaitlistEntry entry = waitlistService.join(classId, studentId, context);
        enrollment.waitlist(context.getNow());
        enrollmentRepository.save(enrollment);

        auditService.record(studentId, classId, AuditAction.WAITLISTED,
                EnrollmentStatus.PENDING, EnrollmentStatus.WAITLISTED,
                "Position " + entry.getPosition(), context.getNow());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("position", entry.getPosition());
        context.emitToStudent(EventType.WAITLIST_JOINED, studentId, data);

        metricsService.recordRequestOutcome(classId, EnrollmentStatus.WAITLISTED.name());
        logger.info("Student {} waitlisted for class {} at position {}", studentId, classId, entry.getPosition());

        // A free seat with nobody holding an offer goes to the head of the queue
        Optional<WaitlistEntry> offered = waitlistService.promoteNext(classId, context);

        EnrollmentResult result = EnrollmentResult.waitlisted(entry.getPosition(),
                "Class is full; waitlisted at position " + entry.getPosition());
        if (offered.isPresent() && offered.get().getStudentId().equals(studentId)) {
            return result.withOfferExpiresAt(offered.get().getOfferExpiresAt());
        }
        return result;
    }

    /**
     * Drop an enrollment or leave the waitlist.
     * Dropping a missing or already terminal enrollment is a successful no-op.
     */
    public EnrollmentResult dropEnrollment(String studentId, String classId, OperationContext context) {
        Optional<Enrollment> active = enrollmentRepository.findActiveEnrollment(studentId, classId);
        if (active.isEmpty()) {
            logger.debug("Drop for student {} in class {} ignored: no active enrollment", studentId, classId);
            return EnrollmentResult.noChange(EnrollmentStatus.DROPPED, "No active enrollment to drop");
        }

        Enrollment enrollment = active.get();
        EnrollmentStatus previous = enrollment.getStatus();

        if (previous == EnrollmentStatus.ENROLLED) {
            int enrolled = capacityStore.releaseSeat(classId);
            enrollment.drop(Enrollment.REASON_STUDENT_DROP, context.getNow());
            enrollmentRepository.save(enrollment);

            auditService.record(studentId, classId, AuditAction.DROPPED,
                    previous, EnrollmentStatus.DROPPED, Enrollment.REASON_STUDENT_DROP, context.getNow());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("enrolledCount", enrolled);
            context.emitToStudent(EventType.ENROLLMENT_DROPPED, studentId, data);

            logger.info("Student {} dropped class {}, enrolled now {}", studentId, classId, enrolled);
            waitlistService.promoteNext(classId, context);
        } else if (previous == EnrollmentStatus.WAITLISTED) {
            Optional<WaitlistEntry> entry = waitlistEntryRepository.findByClassIdAndStudentId(classId, studentId);
            boolean heldOffer = entry.map(WaitlistEntry::hasOutstandingOffer).orElse(false);
            entry.ifPresent(waitlisted -> waitlistService.remove(waitlisted, context));

            enrollment.drop(Enrollment.REASON_STUDENT_DROP, context.getNow());
            enrollmentRepository.save(enrollment);

            auditService.record(studentId, classId, AuditAction.DROPPED,
                    previous, EnrollmentStatus.DROPPED, Enrollment.REASON_STUDENT_DROP, context.getNow());

            logger.info("Student {} left the waitlist for class {}", studentId, classId);
            if (heldOffer) {
                waitlistService.promoteNext(classId, context);
            }
        } else {
            logger.warn("Student {} has a {} enrollment in class {}; nothing to drop",
                    studentId, previous, classId);
            return EnrollmentResult.noChange(previous, "Enrollment is still " + previous);
        }

        metricsService.recordDrop(classId, previous.name());
        return EnrollmentResult.dropped("Dropped from " + classId);
    }
}
