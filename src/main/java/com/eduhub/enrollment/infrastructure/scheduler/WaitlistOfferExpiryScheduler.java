package com.eduhub.enrollment.infrastructure.scheduler;

import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic sweep over outstanding waitlist offers.
 *
 * Each run:
 * 1. Finds offers whose response deadline has passed and expires them
 *    through the coordinator (removal, renumbering, next offer)
 * 2. Finds offers expiring within the reminder window that have not been
 *    reminded yet and sends the one-time deadline reminder
 *
 * Every offer is handled in its own class-locked transaction, so one bad
 * entry does not stop the rest of the sweep. The coordinator re-checks the
 * deadline under the lock, which makes a repeated sweep a no-op.
 * Offer responses also check the deadline lazily, so the maximum lag only
 * affects students who never respond.
 *
 * @author Enrollment Team
 */
@Service
public class WaitlistOfferExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistOfferExpiryScheduler.class);

    private final WaitlistEntryRepository waitlistEntryRepository;
    private final EnrollmentCoordinator coordinator;
    private final CloudWatchMetricsService metricsService;

    @Value("${enrollment.waitlist.expiry-scheduler.enabled:true}")
    private boolean schedulerEnabled = true;

    @Value("${enrollment.waitlist.reminder-window:PT4H}")
    private Duration reminderWindow = Duration.ofHours(4);

    public WaitlistOfferExpiryScheduler(
            WaitlistEntryRepository waitlistEntryRepository,
            EnrollmentCoordinator coordinator,
            CloudWatchMetricsService metricsService
    ) {
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.coordinator = coordinator;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${enrollment.waitlist.expiry-scheduler.fixed-delay-ms:60000}")
    public void sweepOffers() {
        if (!schedulerEnabled) {
            logger.debug("Waitlist offer expiry scheduler is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();

        try {
            int expired = expireDueOffers(Instant.now());
            int reminded = remindPendingOffers(Instant.now());

            if (expired > 0 || reminded > 0) {
                logger.info("Offer sweep completed: {} expired, {} reminded, duration: {}ms",
                        expired, reminded, System.currentTimeMillis() - startTime);
            }
        } catch (Exception e) {
            logger.error("Error in waitlist offer expiry scheduler", e);
            metricsService.recordError("OFFER_EXPIRY_SCHEDULER_ERROR", "sweepOffers");
        }
    }

    /**
     * Manual trigger for the sweep (admin operation, used in tests).
     *
     * @return Number of offers expired
     */
    public int triggerSweepNow() {
        logger.info("Manual offer sweep triggered");
        Instant now = Instant.now();
        int expired = expireDueOffers(now);
        remindPendingOffers(now);
        return expired;
    }

    private int expireDueOffers(Instant now) {
        List<WaitlistEntry> expiredOffers = waitlistEntryRepository.findExpiredOffers(now);
        if (expiredOffers.isEmpty()) {
            return 0;
        }

        logger.info("Found {} expired waitlist offers to process", expiredOffers.size());

        int processed = 0;
        for (WaitlistEntry entry : expiredOffers) {
            try {
                EnrollmentResult result = coordinator.expireOffer(entry.getClassId(), entry.getStudentId());
                if (result.isSuccess() && result.getStatus() == EnrollmentStatus.DROPPED) {
                    processed++;
                } else if (!result.isSuccess()) {
                    logger.warn("Offer expiry for student {} in class {} failed: {}",
                            entry.getStudentId(), entry.getClassId(), result.getReason());
                }
            } catch (Exception e) {
                logger.error("Error expiring offer for student {} in class {}",
                        entry.getStudentId(), entry.getClassId(), e);
                metricsService.recordError("OFFER_EXPIRY_PROCESSING_ERROR", "expireDueOffers");
            }
        }
        return processed;
    }

    /**
     * @return number of reminders actually sent; offers already reminded are skipped
     */
    int remindPendingOffers(Instant now) {
        List<WaitlistEntry> dueForReminder =
                waitlistEntryRepository.findOffersDueForReminder(now, now.plus(reminderWindow));

        int reminded = 0;
        for (WaitlistEntry entry : dueForReminder) {
            try {
                EnrollmentResult result = coordinator.remindOffer(entry.getClassId(), entry.getStudentId());
                if (result.isSuccess() && result.getStatus() == EnrollmentStatus.WAITLISTED) {
                    reminded++;
                }
            } catch (Exception e) {
                logger.error("Error sending offer reminder to student {} in class {}",
                        entry.getStudentId(), entry.getClassId(), e);
                metricsService.recordError("OFFER_REMINDER_PROCESSING_ERROR", "remindPendingOffers");
            }
        }
        return reminded;
    }
}
