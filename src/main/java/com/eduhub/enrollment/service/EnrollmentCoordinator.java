package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.eduhub.enrollment.domain.model.ClassCapacity;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.exception.EnrollmentException;
import com.eduhub.enrollment.exception.ResourceNotFoundException;
import com.eduhub.enrollment.infrastructure.lock.ClassLockRegistry;
import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent.EventType;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.EnrollmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Concurrency Coordinator: the only entry point that mutates enrollment state.
 *
 * Each operation:
 * 1. Validates identifiers before touching any lock
 * 2. Queues for the class lock (fair, arrival order; classes never contend)
 * 3. Runs the state machine inside one transaction, collecting events
 * 4. Commits, publishes the collected events, then releases the lock
 *
 * Any exception rolls the transaction back, drops the collected events and
 * is reported as a failure result. Nothing is thrown to the caller.
 *
 * @author Enrollment Team
 */
@Service
public class EnrollmentCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentCoordinator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private final ClassLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final CapacityStore capacityStore;
    private final EnrollmentStateMachine stateMachine;
    private final WaitlistService waitlistService;
    private final EnrollmentAuditService auditService;
    private final EnrollmentRepository enrollmentRepository;
    private final EnrollmentEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;

    public EnrollmentCoordinator(
            ClassLockRegistry lockRegistry,
            TransactionTemplate transactionTemplate,
            CapacityStore capacityStore,
            EnrollmentStateMachine stateMachine,
            WaitlistService waitlistService,
            EnrollmentAuditService auditService,
            EnrollmentRepository enrollmentRepository,
            EnrollmentEventPublisher eventPublisher,
            CloudWatchMetricsService metricsService
    ) {
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = transactionTemplate;
        this.capacityStore = capacityStore;
        this.stateMachine = stateMachine;
        this.waitlistService = waitlistService;
        this.auditService = auditService;
        this.enrollmentRepository = enrollmentRepository;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Request a seat in a class.
     *
     * @param studentId Student ID
     * @param classId Class ID
     * @param justification Optional note, may be null
     * @return ENROLLED, WAITLISTED with position, or a failure
     */
    public EnrollmentResult requestEnrollment(String studentId, String classId, String justification) {
        Optional<EnrollmentResult> invalid = validateIdentifiers("requestEnrollment", studentId, classId);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        // Cheap rejection without queueing; re-checked under the lock
        if (enrollmentRepository.hasActiveEnrollment(studentId, classId)) {
            logger.warn("Duplicate enrollment request - student: {}, class: {}", studentId, classId);
            metricsService.recordRequestOutcome(classId, EnrollmentStatus.DENIED.name());
            return EnrollmentResult.failure(FailureReason.DUPLICATE_REQUEST,
                    "Student " + studentId + " already has an active enrollment for class " + classId);
        }

        EnrollmentResult result = execute("requestEnrollment", classId,
                context -> stateMachine.requestEnrollment(studentId, classId, justification, context));
        if (!result.isSuccess()) {
            metricsService.recordRequestOutcome(classId,
                    result.getStatus() == EnrollmentStatus.DENIED ? EnrollmentStatus.DENIED.name() : "FAILED");
        }
        return result;
    }

    /**
     * Drop an enrollment or leave the waitlist. Idempotent.
     */
    public EnrollmentResult dropEnrollment(String studentId, String classId) {
        Optional<EnrollmentResult> invalid = validateIdentifiers("dropEnrollment", studentId, classId);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        if (capacityStore.find(classId).isEmpty()) {
            return EnrollmentResult.noChange(EnrollmentStatus.DROPPED, "No active enrollment to drop");
        }
        return execute("dropEnrollment", classId,
                context -> stateMachine.dropEnrollment(studentId, classId, context));
    }

    /**
     * Accept or decline an outstanding waitlist offer.
     *
     * @param accept true to accept, false to decline
     */
    public EnrollmentResult respondToWaitlistOffer(String studentId, String classId, boolean accept) {
        Optional<EnrollmentResult> invalid = validateIdentifiers("respondToWaitlistOffer", studentId, classId);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        return execute("respondToWaitlistOffer", classId,
                context -> waitlistService.resolveOffer(classId, studentId, accept, context));
    }

    /**
     * Expire an offer whose deadline has passed. Used by the expiry sweep;
     * a no-op if the offer was resolved in the meantime.
     */
    public EnrollmentResult expireOffer(String classId, String studentId) {
        return execute("expireOffer", classId, context -> waitlistService.expireIfDue(classId, studentId, context)
                ? EnrollmentResult.dropped("Offer expired")
                : EnrollmentResult.noChange(null, "No expired offer"));
    }

    /**
     * Send the one-time deadline reminder for an outstanding offer.
     * Status is WAITLISTED only when a reminder went out.
     */
    public EnrollmentResult remindOffer(String classId, String studentId) {
        return execute("remindOffer", classId, context -> waitlistService.remindIfDue(classId, studentId, context)
                ? EnrollmentResult.noChange(EnrollmentStatus.WAITLISTED, "Reminder sent")
                : EnrollmentResult.noChange(null, "No reminder due"));
    }

    /**
     * Change a class's capacity. An increase offers the new seat to the waitlist.
     */
    public EnrollmentResult adjustCapacity(String classId, int newCapacity) {
        if (!isValidIdentifier(classId)) {
            return reject("adjustCapacity", FailureReason.VALIDATION_FAILED, "Invalid classId: " + classId);
        }
        if (newCapacity < 0) {
            return reject("adjustCapacity", FailureReason.INVALID_CAPACITY,
                    "Capacity must not be negative: " + newCapacity);
        }

        return execute("adjustCapacity", classId, context -> {
            int previous = capacityStore.adjustCapacity(classId, newCapacity);

            auditService.recordClassAction(classId, AuditAction.CAPACITY_CHANGED,
                    previous + " -> " + newCapacity, context.getNow());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("previousCapacity", previous);
            data.put("capacity", newCapacity);
            context.emitToClass(EventType.CAPACITY_CHANGE, data);
            metricsService.recordCapacityChange(classId, newCapacity);

            if (newCapacity > previous) {
                waitlistService.promoteNext(classId, context);
            }
            return EnrollmentResult.ofSnapshot(capacityStore.readSnapshot(classId),
                    "Capacity changed from " + previous + " to " + newCapacity);
        });
    }

    /**
     * Create the capacity record for a new class.
     *
     * @param teacherId Optional, routes roster events to teacher:{teacherId}
     */
    public EnrollmentResult createClass(String classId, int capacity, String teacherId) {
        return createClass(classId, capacity, null, teacherId);
    }

    /**
     * @param waitlistCapacity queue limit for the class, null for the configured default
     */
    public EnrollmentResult createClass(String classId, int capacity, Integer waitlistCapacity, String teacherId) {
        if (!isValidIdentifier(classId) || (teacherId != null && !isValidIdentifier(teacherId))) {
            return reject("createClass", FailureReason.VALIDATION_FAILED,
                    "Invalid classId or teacherId: " + classId + ", " + teacherId);
        }
        if (capacity < 0 || (waitlistCapacity != null && waitlistCapacity < 0)) {
            return reject("createClass", FailureReason.INVALID_CAPACITY,
                    "Capacity must not be negative: " + capacity + ", waitlist " + waitlistCapacity);
        }

        return lockRegistry.withClassLock(classId, () -> {
            try {
                CapacitySnapshot snapshot = transactionTemplate.execute(status -> {
                    ClassCapacity created = capacityStore.createClass(classId, capacity, waitlistCapacity, teacherId);
                    return CapacitySnapshot.of(created, 0, 0);
                });
                return EnrollmentResult.ofSnapshot(snapshot, "Class " + classId + " created");
            } catch (EnrollmentException e) {
                return reject("createClass", e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Storage failure creating class {}", classId, e);
                metricsService.recordError(FailureReason.STORAGE_FAILURE.name(), "createClass");
                return EnrollmentResult.failure(FailureReason.STORAGE_FAILURE, "Class could not be created");
            }
        });
    }

    /**
     * Run an operation under the class lock inside one transaction.
     * The class must exist; its snapshot is appended as a count update when
     * anything changed. Events are published after commit, before unlock.
     */
    private EnrollmentResult execute(String operation, String classId,
                                     Function<OperationContext, EnrollmentResult> body) {
        long queuedAt = System.nanoTime();

        return lockRegistry.withClassLock(classId, () -> {
            long acquiredAt = System.nanoTime();
            metricsService.recordLockWait(operation, acquiredAt - queuedAt);

            OperationContext context = new OperationContext(operation, classId, Instant.now());
            EnrollmentResult result;
            try {
                result = transactionTemplate.execute(status -> {
                    context.bindClass(capacityStore.load(classId));
                    EnrollmentResult outcome = body.apply(context);
                    if (context.hasEvents()) {
                        context.emitToClass(EventType.ENROLLMENT_COUNT_UPDATE,
                                snapshotData(capacityStore.readSnapshot(classId)));
                    }
                    return outcome;
                });
            } catch (ResourceNotFoundException e) {
                context.discardEvents();
                return reject(operation, FailureReason.CLASS_NOT_FOUND, e.getMessage());
            } catch (EnrollmentException e) {
                context.discardEvents();
                return reject(operation, e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                context.discardEvents();
                logger.error("Storage failure during {} for class {}; rolled back", operation, classId, e);
                metricsService.recordError(FailureReason.STORAGE_FAILURE.name(), operation);
                return EnrollmentResult.failure(FailureReason.STORAGE_FAILURE,
                        "The operation could not be completed; nothing was changed");
            } finally {
                metricsService.recordOperationLatency(operation, System.nanoTime() - acquiredAt);
            }

            if (context.hasEvents()) {
                capacityStore.evictSnapshot(classId);
                publish(context);
            }
            return result;
        });
    }

    private void publish(OperationContext context) {
        try {
            eventPublisher.publish(context.getEvents());
        } catch (RuntimeException e) {
            // State is committed; a failed broadcast must not turn success into failure
            logger.error("Failed to publish {} events for {} on class {}",
                    context.getEvents().size(), context.getOperation(), context.getClassId(), e);
            metricsService.recordError("EVENT_PUBLISH_ERROR", context.getOperation());
        }
    }

    private Optional<EnrollmentResult> validateIdentifiers(String operation, String studentId, String classId) {
        if (!isValidIdentifier(studentId)) {
            return Optional.of(reject(operation, FailureReason.VALIDATION_FAILED, "Invalid studentId: " + studentId));
        }
        if (!isValidIdentifier(classId)) {
            return Optional.of(reject(operation, FailureReason.VALIDATION_FAILED, "Invalid classId: " + classId));
        }
        return Optional.empty();
    }

    private EnrollmentResult reject(String operation, FailureReason reason, String message) {
        logger.warn("{} rejected: {} - {}", operation, reason, message);
        metricsService.recordOperationFailure(operation, reason.name());
        return EnrollmentResult.failure(reason, message);
    }

    static boolean isValidIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    private static Map<String, Object> snapshotData(CapacitySnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("capacity", snapshot.getCapacity());
        data.put("enrolledCount", snapshot.getEnrolledCount());
        data.put("availableSeats", snapshot.getAvailableSeats());
        data.put("waitlistCount", snapshot.getWaitlistCount());
        return data;
    }
}
