package com.eduhub.enrollment.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Enrollment metrics, published to CloudWatch via Micrometer when enabled.
 *
 * Key Metrics:
 * - Enrollment request outcomes (enrolled, waitlisted, denied, failed)
 * - Waitlist offer lifecycle (issued, accepted, declined, expired)
 * - Class lock wait time and operation latency
 * - Notification and broadcast failures
 * - Snapshot cache hit/miss rates
 *
 * @author Enrollment Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "enrollment.";
    private static final String REQUEST_PREFIX = METRIC_PREFIX + "request.";
    private static final String OFFER_PREFIX = METRIC_PREFIX + "offer.";
    private static final String LOCK_PREFIX = METRIC_PREFIX + "lock.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record the outcome of an enrollment request.
     *
     * @param classId Class ID
     * @param outcome ENROLLED, WAITLISTED, DENIED or FAILED
     */
    public void recordRequestOutcome(String classId, String outcome) {
        Counter.builder(REQUEST_PREFIX + "outcome")
                .tag("class_id", classId)
                .tag("outcome", outcome)
                .description("Enrollment requests by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded enrollment request outcome for class: {}, outcome: {}", classId, outcome);
    }

    /**
     * Record a failed coordinator operation.
     *
     * @param operation Operation name (e.g. "requestEnrollment")
     * @param reason Failure reason code
     */
    public void recordOperationFailure(String operation, String reason) {
        Counter.builder(METRIC_PREFIX + "operation.failure")
                .tag("operation", operation)
                .tag("reason", reason)
                .description("Failed enrollment operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded operation failure: {}, reason: {}", operation, reason);
    }

    /**
     * @param classId Class ID
     * @param previousStatus Status the student dropped from
     */
    public void recordDrop(String classId, String previousStatus) {
        Counter.builder(METRIC_PREFIX + "drop")
                .tag("class_id", classId)
                .tag("from_status", previousStatus)
                .description("Dropped enrollments and waitlist entries")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a step in the waitlist offer lifecycle.
     *
     * @param classId Class ID
     * @param stage issued, accepted, declined or expired
     */
    public void recordOffer(String classId, String stage) {
        Counter.builder(OFFER_PREFIX + stage)
                .tag("class_id", classId)
                .description("Waitlist offers " + stage)
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded offer {} for class: {}", stage, classId);
    }

    /**
     * @param classId Class ID
     * @param newCapacity Capacity after the change
     */
    public void recordCapacityChange(String classId, int newCapacity) {
        Counter.builder(METRIC_PREFIX + "capacity.changed")
                .tag("class_id", classId)
                .description("Admin capacity adjustments")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded capacity change for class: {}, capacity: {}", classId, newCapacity);
    }

    /**
     * Time spent queued for a class lock.
     *
     * @param operation Operation waiting for the lock
     * @param waitNanos Wait in nanoseconds
     */
    public void recordLockWait(String operation, long waitNanos) {
        Timer.builder(LOCK_PREFIX + "wait")
                .tag("operation", operation)
                .description("Class lock wait time")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(waitNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Time spent inside the class lock.
     *
     * @param operation Operation name
     * @param durationNanos Duration in nanoseconds
     */
    public void recordOperationLatency(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + "operation.latency")
                .tag("operation", operation)
                .description("Enrollment operation latency under the class lock")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param eventType Event type that could not be handed to Kafka
     */
    public void recordNotificationFailure(String eventType) {
        Counter.builder(METRIC_PREFIX + "notification.failure")
                .tag("event_type", eventType)
                .description("Notifications that failed to publish")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded notification failure for event type: {}", eventType);
    }

    /**
     * @param topicKind class, student or teacher
     */
    public void recordBroadcastFailure(String topicKind) {
        Counter.builder(METRIC_PREFIX + "broadcast.failure")
                .tag("topic_kind", topicKind)
                .description("Realtime broadcasts that failed to send")
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param state connected or disconnected
     */
    public void recordConnection(String state) {
        Counter.builder(METRIC_PREFIX + "realtime.connection")
                .tag("state", state)
                .description("Realtime session lifecycle")
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "STORAGE_FAILURE", "OFFER_EXPIRY_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
