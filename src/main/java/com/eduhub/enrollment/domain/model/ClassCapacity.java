package com.eduhub.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Seat capacity and live enrolled count for one class.
 * This row is the single source of truth for admission decisions.
 *
 * Invariant: 0 <= enrolledCount <= capacity between completed operations.
 * Mutated only while the class lock is held (see EnrollmentCoordinator).
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "class_capacity", indexes = {
    @Index(name = "idx_class_capacity_teacher", columnList = "teacher_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassCapacity {

    public static final int DEFAULT_WAITLIST_CAPACITY = 10;

    @Id
    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    /**
     * Teacher owning the class roster. Null when unassigned.
     */
    @Column(name = "teacher_id", length = 64)
    private String teacherId;

    /**
     * Total seats. Admin-adjustable, never below enrolledCount.
     */
    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    /**
     * Seats currently held by enrolled students.
     */
    @Column(name = "enrolled_count", nullable = false)
    private Integer enrolledCount;

    /**
     * Maximum number of queued students. 0 disables the waitlist.
     */
    @Column(name = "waitlist_capacity", nullable = false)
    private Integer waitlistCapacity;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (enrolledCount == null) {
            enrolledCount = 0;
        }
        if (waitlistCapacity == null) {
            waitlistCapacity = DEFAULT_WAITLIST_CAPACITY;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * @return true if at least one seat is free
     */
    public boolean hasOpenSeat() {
        return capacity != null && enrolledCount != null && enrolledCount < capacity;
    }

    /**
     * @param queued students currently on the waitlist
     * @return true if one more student may join the waitlist
     */
    public boolean hasWaitlistRoom(long queued) {
        return waitlistCapacity == null || queued < waitlistCapacity;
    }

    /**
     * @return free seats, never negative
     */
    public int getAvailableSeats() {
        if (capacity == null || enrolledCount == null) {
            return 0;
        }
        return Math.max(0, capacity - enrolledCount);
    }
}
