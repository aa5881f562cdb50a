package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.eduhub.enrollment.domain.model.ClassCapacity;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.domain.model.OfferStatus;
import com.eduhub.enrollment.exception.EnrollmentException;
import com.eduhub.enrollment.exception.ResourceNotFoundException;
import com.eduhub.enrollment.infrastructure.cache.RedisCacheService;
import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import com.eduhub.enrollment.repository.ClassCapacityRepository;
import com.eduhub.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Capacity Store: seat capacity and enrolled count per class.
 *
 * Admission always goes through {@link #tryReserveSeat(String)}, a single
 * conditional UPDATE. Snapshots are for display only and may be served
 * from Redis.
 *
 * Mutating methods expect the caller to hold the class lock and a transaction.
 *
 * @author Enrollment Team
 */
@Service
public class CapacityStore {

    private static final Logger logger = LoggerFactory.getLogger(CapacityStore.class);

    private final ClassCapacityRepository classCapacityRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final RedisCacheService cacheService;
    private final CloudWatchMetricsService metricsService;

    @Value("${enrollment.waitlist.default-capacity:10}")
    private int defaultWaitlistCapacity = ClassCapacity.DEFAULT_WAITLIST_CAPACITY;

    public CapacityStore(
            ClassCapacityRepository classCapacityRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            RedisCacheService cacheService,
            CloudWatchMetricsService metricsService
    ) {
        this.classCapacityRepository = classCapacityRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * Create the capacity row for a new class.
     *
     * @param waitlistCapacity queue limit, or null for the configured default
     * @throws EnrollmentException CLASS_ALREADY_EXISTS or INVALID_CAPACITY
     */
    public ClassCapacity createClass(String classId, int capacity, Integer waitlistCapacity, String teacherId) {
        if (capacity < 0) {
            throw new EnrollmentException(FailureReason.INVALID_CAPACITY,
                    "Capacity must not be negative: " + capacity);
        }
        if (waitlistCapacity != null && waitlistCapacity < 0) {
            throw new EnrollmentException(FailureReason.INVALID_CAPACITY,
                    "Waitlist capacity must not be negative: " + waitlistCapacity);
        }
        if (classCapacityRepository.existsById(classId)) {
            throw new EnrollmentException(FailureReason.CLASS_ALREADY_EXISTS,
                    "Class " + classId + " already exists");
        }

        ClassCapacity created = classCapacityRepository.save(ClassCapacity.builder()
                .classId(classId)
                .teacherId(teacherId)
                .capacity(capacity)
                .enrolledCount(0)
                .waitlistCapacity(waitlistCapacity != null ? waitlistCapacity : defaultWaitlistCapacity)
                .build());
        logger.info("Created class {} with capacity {}, waitlist {} (teacher: {})",
                classId, capacity, created.getWaitlistCapacity(), teacherId);
        return created;
    }

    /**
     * @throws ResourceNotFoundException if the class does not exist
     */
    public ClassCapacity load(String classId) {
        return classCapacityRepository.findById(classId)
                .orElseThrow(() -> new ResourceNotFoundException("Class", classId));
    }

    public Optional<ClassCapacity> find(String classId) {
        return classCapacityRepository.findById(classId);
    }

    /**
     * Atomically take a seat if enrolledCount < capacity.
     *
     * @param classId Class ID
     * @return true if a seat was taken
     */
    public boolean tryReserveSeat(String classId) {
        boolean reserved = classCapacityRepository.reserveSeat(classId, Instant.now()) == 1;
        logger.debug("Seat reservation for class {}: {}", classId, reserved ? "granted" : "full");
        return reserved;
    }

    /**
     * Give back a seat, floored at zero.
     *
     * @param classId Class ID
     * @return enrolled count after the release
     */
    public int releaseSeat(String classId) {
        if (classCapacityRepository.releaseSeat(classId, Instant.now()) == 0) {
            logger.warn("Seat release for class {} found enrolled count already at zero", classId);
        }
        int enrolled = load(classId).getEnrolledCount();
        logger.debug("Released seat for class {}: enrolled now {}", classId, enrolled);
        return enrolled;
    }

    /**
     * Change the capacity of a class.
     *
     * @param classId Class ID
     * @param newCapacity New capacity, at least the current enrolled count
     * @return capacity before the change
     * @throws EnrollmentException INVALID_CAPACITY when below the enrolled count or negative
     */
    public int adjustCapacity(String classId, int newCapacity) {
        ClassCapacity current = load(classId);
        if (newCapacity < 0 || newCapacity < current.getEnrolledCount()) {
            throw new EnrollmentException(FailureReason.INVALID_CAPACITY, String.format(
                    "Capacity %d is below the %d students enrolled in class %s",
                    newCapacity, current.getEnrolledCount(), classId));
        }
        if (classCapacityRepository.updateCapacity(classId, newCapacity, Instant.now()) == 0) {
            throw new EnrollmentException(FailureReason.INVALID_CAPACITY,
                    "Capacity change rejected for class " + classId);
        }
        logger.info("Capacity for class {} changed {} -> {}", classId, current.getCapacity(), newCapacity);
        return current.getCapacity();
    }

    /**
     * Snapshot for display. Served from Redis when cached, otherwise read
     * from the database and cached.
     *
     * @throws ResourceNotFoundException if the class does not exist
     */
    public CapacitySnapshot getSnapshot(String classId) {
        Optional<CapacitySnapshot> cached = cacheService.getSnapshot(classId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("snapshot");
            return cached.get();
        }
        metricsService.recordCacheMiss("snapshot");

        CapacitySnapshot snapshot = readSnapshot(classId);
        cacheService.cacheSnapshot(snapshot);
        return snapshot;
    }

    /**
     * Snapshot straight from the database, bypassing the cache.
     */
    public CapacitySnapshot readSnapshot(String classId) {
        ClassCapacity classCapacity = load(classId);
        return CapacitySnapshot.of(
                classCapacity,
                waitlistEntryRepository.countByClassId(classId),
                waitlistEntryRepository.countByClassIdAndOfferStatus(classId, OfferStatus.OFFERED)
        );
    }

    /**
     * Drop the cached snapshot after a committed change.
     */
    public void evictSnapshot(String classId) {
        cacheService.invalidateSnapshot(classId);
    }
}
