package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.eduhub.enrollment.domain.model.Enrollment;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.OfferStatus;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import com.eduhub.enrollment.domain.model.WaitlistStats;
import com.eduhub.enrollment.domain.model.WaitlistStudentInfo;
import com.eduhub.enrollment.exception.ResourceNotFoundException;
import com.eduhub.enrollment.repository.EnrollmentRepository;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side for dashboards and students. Takes no class lock, so results
 * may lag one in-flight operation.
 *
 * @author Enrollment Team
 */
@Service
@Transactional(readOnly = true)
public class EnrollmentQueryService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentQueryService.class);

    static final double DAYS_PER_POSITION = 2.5;

    private static final Duration RECENT_ACTIVITY_WINDOW = Duration.ofHours(24);

    private final CapacityStore capacityStore;
    private final EnrollmentRepository enrollmentRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final EnrollmentAuditService auditService;

    public EnrollmentQueryService(
            CapacityStore capacityStore,
            EnrollmentRepository enrollmentRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            EnrollmentAuditService auditService
    ) {
        this.capacityStore = capacityStore;
        this.enrollmentRepository = enrollmentRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.auditService = auditService;
    }

    /**
     * @throws ResourceNotFoundException if the class does not exist
     */
    public CapacitySnapshot getSnapshot(String classId) {
        return capacityStore.getSnapshot(classId);
    }

    /**
     * Latest enrollment record for a pair, including terminal ones.
     */
    public Optional<Enrollment> getEnrollment(String studentId, String classId) {
        return enrollmentRepository.findFirstByStudentIdAndClassIdOrderByRequestedAtDesc(studentId, classId);
    }

    /**
     * @throws ResourceNotFoundException if the class does not exist
     */
    public List<WaitlistEntry> getClassWaitlist(String classId) {
        capacityStore.load(classId);
        return waitlistEntryRepository.findByClassIdOrderByPositionAsc(classId);
    }

    public WaitlistStudentInfo getStudentWaitlistInfo(String studentId, String classId) {
        Optional<WaitlistEntry> entry = waitlistEntryRepository.findByClassIdAndStudentId(classId, studentId);
        if (entry.isEmpty()) {
            return WaitlistStudentInfo.builder()
                    .studentId(studentId)
                    .classId(classId)
                    .onWaitlist(false)
                    .position(0)
                    .offerStatus(OfferStatus.NONE)
                    .estimatedWaitTime("Not on waitlist")
                    .build();
        }

        WaitlistEntry waitlisted = entry.get();
        return WaitlistStudentInfo.builder()
                .studentId(studentId)
                .classId(classId)
                .onWaitlist(true)
                .position(waitlisted.getPosition())
                .offerStatus(waitlisted.getOfferStatus())
                .responseDeadline(waitlisted.getOfferExpiresAt())
                .estimatedWaitTime(estimateWaitTime(waitlisted.getPosition()))
                .build();
    }

    /**
     * @throws ResourceNotFoundException if the class does not exist
     */
    public WaitlistStats getWaitlistStats(String classId) {
        List<WaitlistEntry> entries = getClassWaitlist(classId);
        Instant now = Instant.now();

        double averageWaitDays = entries.stream()
                .mapToLong(entry -> Duration.between(entry.getJoinedAt(), now).toMillis())
                .average()
                .orElse(0.0) / Duration.ofDays(1).toMillis();

        long outstandingOffers = entries.stream().filter(WaitlistEntry::hasOutstandingOffer).count();

        return WaitlistStats.builder()
                .classId(classId)
                .totalWaitlisted(entries.size())
                .averageWaitDays(averageWaitDays)
                .outstandingOffers(outstandingOffers)
                .build();
    }

    /**
     * Audit action counts for the last 24 hours.
     */
    public Map<AuditAction, Long> getRecentActivity(String classId) {
        Map<AuditAction, Long> activity =
                auditService.countActionsSince(classId, Instant.now().minus(RECENT_ACTIVITY_WINDOW));
        logger.debug("Recent activity for class {}: {}", classId, activity);
        return activity;
    }

    /**
     * Rough wait estimate for a waitlist position, 2.5 days per place.
     */
    static String estimateWaitTime(int position) {
        long days = (long) Math.ceil(position * DAYS_PER_POSITION);
        if (days <= 1) {
            return "Less than 1 day";
        } else if (days <= 7) {
            return days + " days";
        } else if (days <= 30) {
            long weeks = (long) Math.ceil(days / 7.0);
            return weeks + (weeks > 1 ? " weeks" : " week");
        }
        long months = (long) Math.ceil(days / 30.0);
        return months + (months > 1 ? " months" : " month");
    }
}
