package com.eduhub.enrollment.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-class mutual exclusion.
 *
 * Each classId maps to a fair ReentrantLock, created on first use and
 * reference-counted so that idle classes do not accumulate entries.
 * Fair locks grant access in arrival order: a waiting operation queues,
 * it never fails or backs off. Different classes never contend.
 *
 * Usage:
 * EnrollmentResult result = lockRegistry.withClassLock(classId, () -> {
 *     // Critical section - capacity and waitlist mutations for classId
 * });
 *
 * The lock is held only inside this JVM. Running several instances against
 * one database additionally relies on the conditional seat UPDATE for the
 * capacity invariant.
 *
 * @author Enrollment Team
 */
@Component
public class ClassLockRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClassLockRegistry.class);

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Run an action while holding the lock for a class.
     * The lock is released on every exit path, including exceptions.
     *
     * @param classId Class ID
     * @param action Critical section
     * @return Result of the action
     */
    public <T> T withClassLock(String classId, Supplier<T> action) {
        LockEntry entry = retain(classId);
        try {
            entry.lock.lock();
            try {
                logger.debug("Acquired class lock: {} (queued: {})", classId, entry.lock.getQueueLength());
                return action.get();
            } finally {
                entry.lock.unlock();
                logger.debug("Released class lock: {}", classId);
            }
        } finally {
            release(classId);
        }
    }

    /**
     * @param classId Class ID
     * @return true if the current thread holds the lock for the class
     */
    public boolean isHeldByCurrentThread(String classId) {
        LockEntry entry = locks.get(classId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    /**
     * @return number of classes with a lock currently held or awaited
     */
    public int activeLockCount() {
        return locks.size();
    }

    private LockEntry retain(String classId) {
        return locks.compute(classId, (key, existing) -> {
            LockEntry entry = existing != null ? existing : new LockEntry();
            entry.references++;
            return entry;
        });
    }

    private void release(String classId) {
        locks.computeIfPresent(classId, (key, entry) -> {
            entry.references--;
            return entry.references == 0 ? null : entry;
        });
    }

    /**
     * Lock plus the number of threads holding or waiting for it.
     * references is only touched inside ConcurrentHashMap.compute for the key.
     */
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int references;
    }
}
